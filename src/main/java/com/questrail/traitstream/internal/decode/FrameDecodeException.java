package com.questrail.traitstream.internal.decode;

/**
 * Indicates that a complete frame could not be parsed as a stream envelope.
 *
 * The frame is dropped; the session keeps streaming.
 */
public final class FrameDecodeException extends Exception
{
    private final int frameLength;

    public FrameDecodeException(String message, int frameLength, Throwable cause) {
        super(message, cause);
        this.frameLength = frameLength;
    }

    public int frameLength() {
        return frameLength;
    }
}
