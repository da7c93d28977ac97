package com.vertector.nats.publisher;

import java.util.UUID;

/**
 * A publish did not succeed: retries were exhausted, the failure was classified as
 * permanent, or the caller was interrupted. The cause is the last underlying error.
 */
public class PublishException extends RuntimeException {

    private final UUID eventId;
    private final String eventType;
    private final int attempts;

    public PublishException(String message, Throwable cause, UUID eventId, String eventType, int attempts) {
        super(message, cause);
        this.eventId = eventId;
        this.eventType = eventType;
        this.attempts = attempts;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getEventType() {
        return eventType;
    }

    /** Attempts made, the failing one included. */
    public int getAttempts() {
        return attempts;
    }
}
