package com.questrail.traitstream.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * One decoded frame: the {@code StreamBody} message of the observe stream.
 *
 * <p>Sub-messages keep their wire order. Order matters downstream because
 * trait state is cumulative and last-write-wins per key.</p>
 *
 * @param messages  ordered sub-messages (never {@code null})
 * @param status    server status attached to the frame, if any
 * @param noopCount number of keepalive noop entries carried by the frame
 */
public record Envelope(List<SubMessage> messages,
                       Optional<StreamStatus> status,
                       int noopCount)
{
    public Envelope {
        messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
        Objects.requireNonNull(status, "status");
        if (noopCount < 0) {
            throw new IllegalArgumentException("noopCount must be non-negative");
        }
    }

    public static Envelope of(List<SubMessage> messages) {
        return new Envelope(messages, Optional.empty(), 0);
    }

    /**
     * All get operations of all sub-messages, in wire order.
     */
    public List<GetOperation> getOperations() {
        return messages.stream()
                .flatMap(m -> m.gets().stream())
                .toList();
    }

    /**
     * Returns a copy with the same status and noop count but new sub-messages.
     */
    public Envelope withMessages(List<SubMessage> replacement) {
        return new Envelope(replacement, status, noopCount);
    }
}
