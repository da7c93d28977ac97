package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a class schedule changed; {@code changes} holds the new values. */
@JsonTypeName(ClassScheduleUpdatedEvent.TYPE)
public record ClassScheduleUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String scheduleId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.schedule.updated";

    public ClassScheduleUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(scheduleId, "scheduleId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static ClassScheduleUpdatedEvent of(EventMetadata metadata, String scheduleId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new ClassScheduleUpdatedEvent(null, null, null, metadata, scheduleId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
