package com.questrail.traitstream.observability;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Transport-level events: connection attempts and their outcomes.
 */
public sealed interface TransportObservabilityEvent
{
    Instant timestamp();

    record Connected(Instant timestamp, URI endpoint, int attempt) implements TransportObservabilityEvent {}

    record ConnectFailed(Instant timestamp, URI endpoint, int attempt, String reason)
            implements TransportObservabilityEvent {}

    record StreamEnded(Instant timestamp, String reason) implements TransportObservabilityEvent {}

    record ReconnectScheduled(Instant timestamp, Duration delay, int consecutiveFailures)
            implements TransportObservabilityEvent {}

    record ReconnectAbandoned(Instant timestamp, int consecutiveFailures) implements TransportObservabilityEvent {}
}
