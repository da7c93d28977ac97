package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A student left a course. */
@JsonTypeName(ProfileUnenrolledEvent.TYPE)
public record ProfileUnenrolledEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String studentId,
        String courseId,
        Instant unenrollDate,
        String reason,
        Double finalGrade,
        String letterGrade
) implements DomainEvent {

    public static final String TYPE = "academic.profile.unenrolled";

    public ProfileUnenrolledEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(studentId, "studentId");
        EventFields.required(courseId, "courseId");
        EventFields.required(unenrollDate, "unenrollDate");
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
