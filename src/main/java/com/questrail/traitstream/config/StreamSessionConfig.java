package com.questrail.traitstream.config;

import com.questrail.traitstream.session.ReconnectPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * StreamSessionConfig
 * -----------------------------------------------------------------------------
 * Operational configuration of a stream session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>reconnectPolicy</b>: delay between connection attempts after a
 *       failure. Default: fixed 10 s, unbounded.</li>
 *   <li><b>keepaliveInterval</b>: how long a single transport read waits
 *       before yielding with no data. No ping is sent. Default: 60 ms.</li>
 *   <li><b>readTimeout</b>: a connection that delivers no bytes for this long
 *       is treated as failed. Default: 600 s.</li>
 *   <li><b>catalogThreshold</b>: frame buffer size that, while a frame is
 *       still incomplete, is reported as a bulk-catalog burst. Default: 20000
 *       bytes.</li>
 * </ul>
 */
public record StreamSessionConfig(
        ReconnectPolicy reconnectPolicy,
        Duration keepaliveInterval,
        Duration readTimeout,
        int catalogThreshold
) {
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_KEEPALIVE_INTERVAL = Duration.ofMillis(60);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(600);
    public static final int DEFAULT_CATALOG_THRESHOLD = 20_000;

    public StreamSessionConfig {
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        Objects.requireNonNull(keepaliveInterval, "keepaliveInterval");
        Objects.requireNonNull(readTimeout, "readTimeout");

        if (keepaliveInterval.isNegative() || keepaliveInterval.isZero()) {
            throw new IllegalArgumentException("keepaliveInterval must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        if (catalogThreshold <= 0) {
            throw new IllegalArgumentException("catalogThreshold must be positive");
        }
    }

    public static StreamSessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.fixedDelay(DEFAULT_RETRY_DELAY);
        private Duration keepaliveInterval = DEFAULT_KEEPALIVE_INTERVAL;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private int catalogThreshold = DEFAULT_CATALOG_THRESHOLD;

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder withKeepaliveInterval(Duration keepaliveInterval) {
            this.keepaliveInterval = keepaliveInterval;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withCatalogThreshold(int catalogThreshold) {
            this.catalogThreshold = catalogThreshold;
            return this;
        }

        public StreamSessionConfig build() {
            return new StreamSessionConfig(reconnectPolicy, keepaliveInterval, readTimeout, catalogThreshold);
        }
    }
}
