package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A quiz was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(QuizDeletedEvent.TYPE)
public record QuizDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String quizId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.quiz.deleted";

    public QuizDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(quizId, "quizId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static QuizDeletedEvent of(EventMetadata metadata, String quizId, String deletionReason) {
        return new QuizDeletedEvent(null, null, null, metadata, quizId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
