package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A challenge area was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(ChallengeAreaDeletedEvent.TYPE)
public record ChallengeAreaDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String challengeId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.challenge.deleted";

    public ChallengeAreaDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(challengeId, "challengeId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static ChallengeAreaDeletedEvent of(EventMetadata metadata, String challengeId, String deletionReason) {
        return new ChallengeAreaDeletedEvent(null, null, null, metadata, challengeId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
