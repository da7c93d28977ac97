package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A student enrolled in a course. */
@JsonTypeName(ProfileEnrolledEvent.TYPE)
public record ProfileEnrolledEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String studentId,
        String courseId,
        Instant enrollmentDate,
        String gradingBasis,
        String enrollmentStatus,
        Double finalGrade,
        String letterGrade
) implements DomainEvent {

    public static final String TYPE = "academic.profile.enrolled";

    public ProfileEnrolledEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(studentId, "studentId");
        EventFields.required(courseId, "courseId");
        EventFields.required(enrollmentDate, "enrollmentDate");
        gradingBasis = EventFields.orDefault(gradingBasis, "Letter");
        enrollmentStatus = EventFields.orDefault(enrollmentStatus, "Active");
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
