package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of an assignment changed; {@code changes} holds the new values. */
@JsonTypeName(AssignmentUpdatedEvent.TYPE)
public record AssignmentUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String assignmentId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.assignment.updated";

    public AssignmentUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(assignmentId, "assignmentId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static AssignmentUpdatedEvent of(EventMetadata metadata, String assignmentId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new AssignmentUpdatedEvent(null, null, null, metadata, assignmentId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
