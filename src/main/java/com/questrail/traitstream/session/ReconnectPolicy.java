package com.questrail.traitstream.session;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Decides how long a session waits before reconnecting, and whether it
 * reconnects at all.
 *
 * <p>This is operational only: the session decides <em>that</em> a
 * connection has failed; the policy controls <em>when</em> the next attempt
 * runs.</p>
 *
 * <h2>Built-in policies</h2>
 * <ul>
 *   <li>{@link #fixedDelay(Duration)}: same delay forever. The default.</li>
 *   <li>{@link #exponentialBackoff(Duration, Duration, int)}: doubling delay
 *       with a cap and an attempt limit.</li>
 * </ul>
 */
public interface ReconnectPolicy
{
    /**
     * @param consecutiveFailures failures since the last frame was received,
     *                            at least {@code 1}
     * @return the delay before the next attempt, or empty to stop reconnecting
     */
    Optional<Duration> nextDelay(int consecutiveFailures);

    static ReconnectPolicy fixedDelay(Duration delay) {
        return new FixedDelay(delay);
    }

    static ReconnectPolicy exponentialBackoff(Duration initialDelay, Duration maxDelay, int maxAttempts) {
        return new ExponentialBackoff(initialDelay, maxDelay, maxAttempts);
    }

    /**
     * Unbounded retry at a constant interval.
     */
    record FixedDelay(Duration delay) implements ReconnectPolicy {
        public FixedDelay {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must be non-negative");
            }
        }

        @Override
        public Optional<Duration> nextDelay(int consecutiveFailures) {
            return Optional.of(delay);
        }
    }

    /**
     * {@code initialDelay * 2^(n-1)}, capped at {@code maxDelay}; gives up after
     * {@code maxAttempts} consecutive failures.
     */
    record ExponentialBackoff(Duration initialDelay, Duration maxDelay, int maxAttempts) implements ReconnectPolicy {
        public ExponentialBackoff {
            Objects.requireNonNull(initialDelay, "initialDelay");
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must be non-negative");
            }
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= initialDelay");
            }
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
        }

        @Override
        public Optional<Duration> nextDelay(int consecutiveFailures) {
            if (consecutiveFailures > maxAttempts) {
                return Optional.empty();
            }
            int exponent = Math.min(Math.max(consecutiveFailures - 1, 0), 30);
            Duration delay = initialDelay.multipliedBy(1L << exponent);
            return Optional.of(delay.compareTo(maxDelay) > 0 ? maxDelay : delay);
        }
    }
}
