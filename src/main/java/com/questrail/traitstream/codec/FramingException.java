package com.questrail.traitstream.codec;

/**
 * Raised when the buffered byte stream can no longer be split into frames.
 *
 * <p>This is a stream-level defect rather than a frame-level one: once a
 * length prefix is malformed there is no way to find the next frame boundary,
 * so the owning session abandons the connection and starts over with an
 * empty buffer.</p>
 */
public final class FramingException extends RuntimeException
{
    public FramingException(String message) {
        super(message);
    }
}
