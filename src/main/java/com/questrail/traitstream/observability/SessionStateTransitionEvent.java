package com.questrail.traitstream.observability;

import com.questrail.traitstream.session.SessionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a lifecycle transition of a stream session.
 *
 * @param reason short human-readable cause, e.g. {@code "read timeout"}
 */
public record SessionStateTransitionEvent(
    Instant timestamp,
    SessionState oldState,
    SessionState newState,
    String reason
) {
    public SessionStateTransitionEvent {
        Objects.requireNonNull(oldState, "oldState");
        Objects.requireNonNull(newState, "newState");
        Objects.requireNonNull(reason, "reason");
    }

    /**
     * Transitions into {@link SessionState#DISCONNECTED} are the ones consumers
     * see as a sentinel snapshot.
     */
    public boolean isDisconnect() {
        return newState == SessionState.DISCONNECTED;
    }
}
