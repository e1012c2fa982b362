package com.questrail.traitstream.transport;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Minimal port for opening a streaming POST.
 *
 * <p>Implementations may be backed by Netty, the JDK HTTP client, or a test
 * harness. They perform I/O only: no framing, no decoding, no retries.</p>
 */
public interface StreamTransport
{
    /**
     * Opens one streaming request.
     *
     * @throws TransportException if the connection cannot be established
     */
    ChunkStream open(StreamRequest request) throws TransportException, InterruptedException;
}
