package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.UUID;

/** A course was deleted, softly unless {@code softDelete} is false. */
@JsonTypeName(CourseDeletedEvent.TYPE)
public record CourseDeletedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String courseId,
        Boolean softDelete,
        String deletionReason
) implements DomainEvent {

    public static final String TYPE = "academic.course.deleted";

    public CourseDeletedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(courseId, "courseId");
        softDelete = EventFields.orDefault(softDelete, Boolean.TRUE);
    }

    public static CourseDeletedEvent of(EventMetadata metadata, String courseId, String deletionReason) {
        return new CourseDeletedEvent(null, null, null, metadata, courseId, null, deletionReason);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
