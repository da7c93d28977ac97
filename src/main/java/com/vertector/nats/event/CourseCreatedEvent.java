package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A course was created. */
@JsonTypeName(CourseCreatedEvent.TYPE)
public record CourseCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String courseId,
        String title,
        String code,
        String number,
        String term,
        Integer credits,
        String description,
        String instructorName,
        String instructorEmail,
        String institutionId,
        List<String> componentType,
        List<String> prerequisites,
        List<String> gradingOptions,
        String syllabusUrl,
        List<String> learningObjectives,
        Instant finalExamDate
) implements DomainEvent {

    public static final String TYPE = "academic.course.created";

    public CourseCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(courseId, "courseId");
        EventFields.required(title, "title");
        EventFields.required(code, "code");
        EventFields.required(number, "number");
        EventFields.required(term, "term");
        EventFields.required(credits, "credits");
        EventFields.required(description, "description");
        EventFields.required(instructorName, "instructorName");
        EventFields.required(instructorEmail, "instructorEmail");
        EventFields.required(institutionId, "institutionId");
        componentType = EventFields.list(componentType);
        prerequisites = EventFields.list(prerequisites);
        gradingOptions = gradingOptions == null ? List.of("Letter") : List.copyOf(gradingOptions);
        learningObjectives = EventFields.list(learningObjectives);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
