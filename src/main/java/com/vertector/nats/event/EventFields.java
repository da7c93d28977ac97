package com.vertector.nats.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Defaulting and validation shared by the compact constructors of the catalog records.
 */
final class EventFields {

    static final String DEFAULT_VERSION = "1.0";

    private EventFields() {
    }

    static UUID eventId(UUID value) {
        return value == null ? UUID.randomUUID() : value;
    }

    static String version(String value) {
        return value == null || value.isBlank() ? DEFAULT_VERSION : value;
    }

    static Instant timestamp(Instant value) {
        return value == null ? Instant.now() : value;
    }

    static EventMetadata metadata(EventMetadata value) {
        return Objects.requireNonNull(value, "metadata is required");
    }

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }

    static <T> List<T> list(List<T> value) {
        return value == null ? List.of() : List.copyOf(value);
    }

    /** Null stays null; used for optional lists. */
    static <T> List<T> optionalList(List<T> value) {
        return value == null ? null : List.copyOf(value);
    }

    /** Copies a free-form map, keeping JSON {@code null} values. */
    static Map<String, Object> map(Map<String, Object> value) {
        return value == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    static Map<String, Object> optionalMap(Map<String, Object> value) {
        return value == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }
}
