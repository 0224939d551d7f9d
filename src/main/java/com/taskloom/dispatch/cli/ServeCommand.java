package com.taskloom.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskloom serve
 * <p>
 * Starts Taskloom as a long-running HTTP server exposing session status, abort and
 * SSE event streams, and runs the cron scheduler. The web server is enabled by
 * {@link com.taskloom.TaskloomApplication#main} detecting "serve" in args.
 * <p>
 * In serve mode, {@link CliRunner} skips picocli so the embedded web server keeps
 * the JVM alive. The banner is printed once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Taskloom HTTP server and cron scheduler")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Taskloom server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Sessions:   http://localhost:" + port + "/api/v1/sessions");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
