package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a study todo changed; {@code changes} holds the new values. */
@JsonTypeName(StudyTodoUpdatedEvent.TYPE)
public record StudyTodoUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String todoId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.study.updated";

    public StudyTodoUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(todoId, "todoId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static StudyTodoUpdatedEvent of(EventMetadata metadata, String todoId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new StudyTodoUpdatedEvent(null, null, null, metadata, todoId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
