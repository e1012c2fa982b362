package com.questrail.traitstream.transport;

import java.io.IOException;

/**
 * A transport-level failure: connection refused, reset, TLS failure, or a
 * non-success HTTP status. Terminal for the current connection attempt only.
 */
public class TransportException extends IOException
{
    private final int statusCode;

    public TransportException(String message) {
        this(message, -1, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status that caused the failure, or {@code -1} if none applies.
     */
    public int statusCode() {
        return statusCode;
    }
}
