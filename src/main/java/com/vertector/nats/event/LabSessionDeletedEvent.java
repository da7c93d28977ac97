package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A lab session was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(LabSessionDeletedEvent.TYPE)
public record LabSessionDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String labId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.lab.deleted";

    public LabSessionDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(labId, "labId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static LabSessionDeletedEvent of(EventMetadata metadata, String labId, String deletionReason) {
        return new LabSessionDeletedEvent(null, null, null, metadata, labId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
