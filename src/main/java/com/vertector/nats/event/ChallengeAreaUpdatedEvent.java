package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a challenge area changed; {@code changes} holds the new values. */
@JsonTypeName(ChallengeAreaUpdatedEvent.TYPE)
public record ChallengeAreaUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String challengeId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.challenge.updated";

    public ChallengeAreaUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(challengeId, "challengeId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static ChallengeAreaUpdatedEvent of(EventMetadata metadata, String challengeId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new ChallengeAreaUpdatedEvent(null, null, null, metadata, challengeId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
