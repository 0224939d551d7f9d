package com.taskloom.core.scheduler;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Five-field Unix cron support ({@code minute hour day-of-month month day-of-week}).
 * <p>
 * When both day fields are restricted a day matches if either of them does.
 */
public final class CronExpressions {

    private static final Logger log = LoggerFactory.getLogger(CronExpressions.class);

    static final int FIELD_COUNT = 5;

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronDescriptor DESCRIPTOR = CronDescriptor.instance(Locale.ENGLISH);

    private CronExpressions() {}

    /**
     * Parses a five-field expression.
     *
     * @throws IllegalArgumentException if the expression is blank, has the wrong number
     *                                  of fields or contains an invalid field
     */
    public static Cron parse(String expression) {
        String[] fields = fields(expression);
        return PARSER.parse(String.join(" ", fields)).validate();
    }

    /**
     * Next fire time strictly after {@code from}, or empty if the expression is invalid
     * or never fires again.
     */
    public static Optional<Instant> nextRun(String expression, Instant from, ZoneId zone) {
        try {
            return next(parse(expression), from, zone);
        } catch (IllegalArgumentException e) {
            log.error("Failed to parse cron expression '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    public static CronValidation validate(String expression, Instant now, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            return CronValidation.invalid("Expression is required");
        }
        try {
            Cron cron = parse(expression);
            Optional<Instant> next = next(cron, now, zone);
            if (next.isEmpty()) {
                return CronValidation.invalid("Expression never fires");
            }
            return CronValidation.ok(describe(cron), next.get().toString());
        } catch (IllegalArgumentException e) {
            return CronValidation.invalid(e.getMessage() != null ? e.getMessage() : "Invalid cron expression");
        }
    }

    private static Optional<Instant> next(Cron cron, Instant from, ZoneId zone) {
        return ExecutionTime.forCron(cron).nextExecution(from.atZone(zone)).map(ZonedDateTime::toInstant);
    }

    private static String describe(Cron cron) {
        String description = DESCRIPTOR.describe(cron);
        if (description == null || description.isBlank()) {
            return "Valid schedule";
        }
        description = description.trim();
        return Character.toUpperCase(description.charAt(0)) + description.substring(1);
    }

    private static String[] fields(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression is required");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new IllegalArgumentException("Expected " + FIELD_COUNT + " fields but found " + fields.length
                    + " in '" + expression.trim() + "'");
        }
        return fields;
    }
}
