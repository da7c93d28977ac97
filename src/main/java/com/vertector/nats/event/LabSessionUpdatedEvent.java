package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a lab session changed; {@code changes} holds the new values. */
@JsonTypeName(LabSessionUpdatedEvent.TYPE)
public record LabSessionUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String labId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.lab.updated";

    public LabSessionUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(labId, "labId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static LabSessionUpdatedEvent of(EventMetadata metadata, String labId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new LabSessionUpdatedEvent(null, null, null, metadata, labId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
