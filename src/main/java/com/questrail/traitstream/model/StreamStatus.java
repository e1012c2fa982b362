package com.questrail.traitstream.model;

import java.util.Objects;

/**
 * The {@code google.rpc.Status} a server may attach to a frame.
 *
 * @param code    canonical status code; {@code 0} is OK
 * @param message developer-facing message, empty when absent
 */
public record StreamStatus(int code, String message)
{
    public StreamStatus {
        Objects.requireNonNull(message, "message");
    }

    public boolean isOk() {
        return code == 0;
    }
}
