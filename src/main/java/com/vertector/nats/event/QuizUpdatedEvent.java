package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a quiz changed; {@code changes} holds the new values. */
@JsonTypeName(QuizUpdatedEvent.TYPE)
public record QuizUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String quizId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.quiz.updated";

    public QuizUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(quizId, "quizId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static QuizUpdatedEvent of(EventMetadata metadata, String quizId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new QuizUpdatedEvent(null, null, null, metadata, quizId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
