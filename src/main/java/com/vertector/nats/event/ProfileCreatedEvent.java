package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A student profile was created. */
@JsonTypeName(ProfileCreatedEvent.TYPE)
public record ProfileCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String studentId,
        String email,
        String firstName,
        String lastName,
        String institutionId,
        String major,
        String minor,
        Integer year,
        String enrollmentStatus,
        String studentType,
        Instant matriculationDate,
        Instant expectedGraduation,
        Double cumulativeGpa,
        String phone,
        String emergencyContact,
        String academicAdvisor,
        String profilePictureUrl
) implements DomainEvent {

    public static final String TYPE = "academic.profile.created";

    public ProfileCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(studentId, "studentId");
        EventFields.required(email, "email");
        EventFields.required(firstName, "firstName");
        EventFields.required(lastName, "lastName");
        EventFields.required(institutionId, "institutionId");
        EventFields.required(matriculationDate, "matriculationDate");
        enrollmentStatus = EventFields.orDefault(enrollmentStatus, "Active");
        studentType = EventFields.orDefault(studentType, "Undergraduate");
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
