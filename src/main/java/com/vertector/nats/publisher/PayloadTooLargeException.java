package com.vertector.nats.publisher;

import java.util.UUID;

/** Encoded event exceeds the configured payload ceiling. */
public class PayloadTooLargeException extends EventValidationException {

    private final UUID eventId;
    private final String eventType;
    private final int size;
    private final int limit;

    public PayloadTooLargeException(UUID eventId, String eventType, int size, int limit) {
        super("Event id=" + eventId + " type=" + eventType + " is " + size
                + " bytes, exceeding the limit of " + limit + " bytes");
        this.eventId = eventId;
        this.eventType = eventType;
        this.size = size;
        this.limit = limit;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getEventType() {
        return eventType;
    }

    public int getSize() {
        return size;
    }

    public int getLimit() {
        return limit;
    }
}
