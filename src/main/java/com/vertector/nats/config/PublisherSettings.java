package com.vertector.nats.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Publisher tuning.
 *
 * @param defaultTimeout   per-attempt write timeout used when the caller passes none
 * @param maxRetries       total attempts per publish, the first one included
 * @param retryBackoffBase base of the exponential backoff; attempt {@code i} is followed
 *                         by a sleep of {@code retryBackoffBase^i} seconds
 * @param maxPayloadBytes  encoded size ceiling, at least 1024
 */
public record PublisherSettings(
        Duration defaultTimeout,
        int maxRetries,
        double retryBackoffBase,
        int maxPayloadBytes
) {

    public static final int MIN_PAYLOAD_BYTES = 1024;
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 1024 * 1024;

    public PublisherSettings {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout is required");
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive, was " + defaultTimeout);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, was " + maxRetries);
        }
        if (!(retryBackoffBase >= 1.0) || Double.isInfinite(retryBackoffBase)) {
            throw new IllegalArgumentException("retryBackoffBase must be a finite value >= 1.0, was " + retryBackoffBase);
        }
        if (maxPayloadBytes < MIN_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("maxPayloadBytes must be >= " + MIN_PAYLOAD_BYTES + ", was " + maxPayloadBytes);
        }
    }

    /** 5 s timeout, 3 attempts, base 2.0, 1 MiB payload ceiling. */
    public static PublisherSettings defaults() {
        return new PublisherSettings(Duration.ofSeconds(5), 3, 2.0, DEFAULT_MAX_PAYLOAD_BYTES);
    }

    /** Backoff inserted after the zero-based attempt {@code attemptIndex}. */
    public Duration backoffAfter(int attemptIndex) {
        double seconds = Math.pow(retryBackoffBase, attemptIndex);
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}
