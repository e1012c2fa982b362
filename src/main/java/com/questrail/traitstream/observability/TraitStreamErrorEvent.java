package com.questrail.traitstream.observability;

import java.time.Instant;

/**
 * Record representing a recovered error in the trait stream pipeline.
 *
 * @param cause the underlying exception, may be {@code null}
 */
public record TraitStreamErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
