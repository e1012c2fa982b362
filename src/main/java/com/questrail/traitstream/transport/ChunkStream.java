package com.questrail.traitstream.transport;

import java.time.Duration;

/**
 * ChunkStream
 * -----------------------------------------------------------------------------
 * One open streaming response, read as raw byte chunks.
 *
 * <p>Chunk boundaries carry no meaning; a frame may be split across any
 * number of chunks. Only one thread reads a stream.</p>
 */
public interface ChunkStream extends AutoCloseable
{
    /**
     * Waits at most {@code wait} for the next chunk.
     *
     * @return {@link ChunkRead.Data}, {@link ChunkRead.Idle} if the window
     *         elapsed, or {@link ChunkRead.End} once the server has finished
     * @throws TransportException if the connection failed
     */
    ChunkRead read(Duration wait) throws TransportException, InterruptedException;

    /**
     * Closes the connection. Idempotent; a blocked {@link #read} returns
     * promptly.
     */
    @Override
    void close();
}
