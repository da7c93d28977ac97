package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A class schedule was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(ClassScheduleDeletedEvent.TYPE)
public record ClassScheduleDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String scheduleId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.schedule.deleted";

    public ClassScheduleDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(scheduleId, "scheduleId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static ClassScheduleDeletedEvent of(EventMetadata metadata, String scheduleId, String deletionReason) {
        return new ClassScheduleDeletedEvent(null, null, null, metadata, scheduleId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
