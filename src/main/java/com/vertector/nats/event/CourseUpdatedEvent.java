package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Fields of a course changed; {@code changes} holds the new values. */
@JsonTypeName(CourseUpdatedEvent.TYPE)
public record CourseUpdatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String courseId,
        Map<String, Object> changes,
        Map<String, Object> previousValues
) implements DomainEvent {

    public static final String TYPE = "academic.course.updated";

    public CourseUpdatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(courseId, "courseId");
        changes = EventFields.map(EventFields.required(changes, "changes"));
        previousValues = EventFields.optionalMap(previousValues);
    }

    public static CourseUpdatedEvent of(EventMetadata metadata, String courseId,
            Map<String, Object> changes, Map<String, Object> previousValues) {
        return new CourseUpdatedEvent(null, null, null, metadata, courseId, changes, previousValues);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
