package com.vertector.nats.config;

import io.nats.client.api.AckPolicy;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.DiscardPolicy;
import io.nats.client.api.ReplayPolicy;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;

import java.util.Locale;

/**
 * Parses the lower-case policy names used in configuration files into jnats enums.
 *
 * <p>This is the only place where string to policy translation happens. Blank input
 * falls back to the library default for that policy; unknown input is rejected.</p>
 */
public final class JetStreamPolicies {

    private JetStreamPolicies() {
    }

    /** Default: {@code workqueue}. */
    public static RetentionPolicy parseRetentionPolicy(String value) {
        if (isBlank(value)) {
            return RetentionPolicy.WorkQueue;
        }
        return switch (normalize(value)) {
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    /** Default: {@code file}. */
    public static StorageType parseStorageType(String value) {
        if (isBlank(value)) {
            return StorageType.File;
        }
        return switch (normalize(value)) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }

    /** Default: {@code old}. */
    public static DiscardPolicy parseDiscardPolicy(String value) {
        if (isBlank(value)) {
            return DiscardPolicy.Old;
        }
        return switch (normalize(value)) {
            case "old" -> DiscardPolicy.Old;
            case "new" -> DiscardPolicy.New;
            default -> throw new IllegalArgumentException("Unsupported discardPolicy: " + value);
        };
    }

    /** Default: {@code explicit}. */
    public static AckPolicy parseAckPolicy(String value) {
        if (isBlank(value)) {
            return AckPolicy.Explicit;
        }
        return switch (normalize(value)) {
            case "explicit" -> AckPolicy.Explicit;
            case "all" -> AckPolicy.All;
            case "none" -> AckPolicy.None;
            default -> throw new IllegalArgumentException("Unsupported ackPolicy: " + value);
        };
    }

    /** Default: {@code all}. */
    public static DeliverPolicy parseDeliverPolicy(String value) {
        if (isBlank(value)) {
            return DeliverPolicy.All;
        }
        return switch (normalize(value)) {
            case "all" -> DeliverPolicy.All;
            case "last" -> DeliverPolicy.Last;
            case "new" -> DeliverPolicy.New;
            case "by_start_sequence", "by-start-sequence" -> DeliverPolicy.ByStartSequence;
            case "by_start_time", "by-start-time" -> DeliverPolicy.ByStartTime;
            default -> throw new IllegalArgumentException("Unsupported deliverPolicy: " + value);
        };
    }

    /** Default: {@code instant}. */
    public static ReplayPolicy parseReplayPolicy(String value) {
        if (isBlank(value)) {
            return ReplayPolicy.Instant;
        }
        return switch (normalize(value)) {
            case "instant" -> ReplayPolicy.Instant;
            case "original" -> ReplayPolicy.Original;
            default -> throw new IllegalArgumentException("Unsupported replayPolicy: " + value);
        };
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
