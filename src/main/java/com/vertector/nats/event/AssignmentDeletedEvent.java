package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** An assignment was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(AssignmentDeletedEvent.TYPE)
public record AssignmentDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String assignmentId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.assignment.deleted";

    public AssignmentDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(assignmentId, "assignmentId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static AssignmentDeletedEvent of(EventMetadata metadata, String assignmentId, String deletionReason) {
        return new AssignmentDeletedEvent(null, null, null, metadata, assignmentId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
