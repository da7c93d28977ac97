package com.vertector.nats.config;

import io.nats.client.api.DiscardPolicy;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a durable stream.
 *
 * <p>Created or updated idempotently by
 * {@link com.vertector.nats.jetstream.StreamProvisioner} when the connection comes
 * up; treated as immutable afterwards.</p>
 *
 * @param name      stream name as registered on the server
 * @param subjects  subject patterns captured by the stream, at least one
 * @param retention retention policy
 * @param storage   storage class
 * @param maxAge    maximum message age, {@link Duration#ZERO} for unlimited
 * @param maxBytes  maximum stream size in bytes, {@code -1} for unlimited
 * @param replicas  replica count, 1 to 5
 * @param discard   discard policy applied when a limit is hit
 */
public record StreamDefinition(
        String name,
        List<String> subjects,
        RetentionPolicy retention,
        StorageType storage,
        Duration maxAge,
        long maxBytes,
        int replicas,
        DiscardPolicy discard
) {

    /** 10 GiB, the size ceiling applied when none is configured. */
    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024 * 1024;

    public StreamDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stream name is required");
        }
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects is required for stream " + name);
        }
        subjects = List.copyOf(subjects);
        Objects.requireNonNull(retention, "retention is required for stream " + name);
        Objects.requireNonNull(storage, "storage is required for stream " + name);
        Objects.requireNonNull(maxAge, "maxAge is required for stream " + name);
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be >= 0 for stream " + name);
        }
        if (maxBytes < -1) {
            throw new IllegalArgumentException("maxBytes must be >= -1 for stream " + name);
        }
        if (replicas < 1 || replicas > 5) {
            throw new IllegalArgumentException("replicas must be between 1 and 5 for stream " + name);
        }
        discard = discard == null ? DiscardPolicy.Old : discard;
    }

    /** Work-queue, file-backed, 7 day stream with the default size ceiling. */
    public static StreamDefinition of(String name, List<String> subjects) {
        return new StreamDefinition(name, subjects, RetentionPolicy.WorkQueue, StorageType.File,
                Duration.ofDays(7), DEFAULT_MAX_BYTES, 1, DiscardPolicy.Old);
    }
}
