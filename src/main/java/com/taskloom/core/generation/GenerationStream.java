package com.taskloom.core.generation;

/**
 * Handle on a live streamed exchange.
 * <p>
 * {@link #next()} blocks until the next chunk is available and returns null at the
 * end of the stream. {@link #interrupt()} requests cooperative cancellation; the
 * consuming loop then sees a {@link GenerationException} or the end of the stream.
 */
public interface GenerationStream extends AutoCloseable {

    StreamChunk next() throws GenerationException;

    void interrupt();

    @Override
    void close();
}
