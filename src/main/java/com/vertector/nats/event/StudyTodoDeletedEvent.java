package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A study todo was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(StudyTodoDeletedEvent.TYPE)
public record StudyTodoDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String todoId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.study.deleted";

    public StudyTodoDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(todoId, "todoId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static StudyTodoDeletedEvent of(EventMetadata metadata, String todoId, String deletionReason) {
        return new StudyTodoDeletedEvent(null, null, null, metadata, todoId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
