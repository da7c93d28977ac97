package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** An exam was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(ExamDeletedEvent.TYPE)
public record ExamDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String examId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.exam.deleted";

    public ExamDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(examId, "examId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static ExamDeletedEvent of(EventMetadata metadata, String examId, String deletionReason) {
        return new ExamDeletedEvent(null, null, null, metadata, examId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
