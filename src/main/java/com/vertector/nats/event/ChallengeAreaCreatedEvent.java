package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A learning challenge was identified for a student. */
@JsonTypeName(ChallengeAreaCreatedEvent.TYPE)
public record ChallengeAreaCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String challengeId,
        String title,
        String studentId,
        String courseId,
        String description,
        String severity,
        Instant identifiedDate,
        String detectionMethod,
        String status,
        Instant resolutionDate,
        List<Double> performanceTrend,
        Integer confidenceLevel,
        List<String> relatedTopics,
        String improvementNotes
) implements DomainEvent {

    public static final String TYPE = "academic.challenge.created";

    public ChallengeAreaCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(challengeId, "challengeId");
        EventFields.required(title, "title");
        EventFields.required(studentId, "studentId");
        EventFields.required(description, "description");
        EventFields.required(severity, "severity");
        EventFields.required(detectionMethod, "detectionMethod");
        EventFields.required(confidenceLevel, "confidenceLevel");
        identifiedDate = identifiedDate == null ? Instant.now() : identifiedDate;
        status = EventFields.orDefault(status, "Active");
        performanceTrend = EventFields.list(performanceTrend);
        relatedTopics = EventFields.list(relatedTopics);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
