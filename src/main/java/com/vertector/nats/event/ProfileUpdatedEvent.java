package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a student profile changed. */
@JsonTypeName(ProfileUpdatedEvent.TYPE)
public record ProfileUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String studentId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.profile.updated";

    public ProfileUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(studentId, "studentId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static ProfileUpdatedEvent of(EventMetadata metadata, String studentId,
                                         Map<String, Object> changes, Map<String, Object> previousValues) {
        return new ProfileUpdatedEvent(null, null, null, metadata, studentId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
