package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of an exam changed; {@code changes} holds the new values. */
@JsonTypeName(ExamUpdatedEvent.TYPE)
public record ExamUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String examId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.exam.updated";

    public ExamUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(examId, "examId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static ExamUpdatedEvent of(EventMetadata metadata, String examId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new ExamUpdatedEvent(null, null, null, metadata, examId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
