package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** An exam was scheduled. */
@JsonTypeName(ExamCreatedEvent.TYPE)
public record ExamCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String examId,
        String title,
        String courseId,
        String studentId,
        String examType,
        Instant date,
        Integer durationMinutes,
        String location,
        Integer pointsPossible,
        Double pointsEarned,
        Double percentageGrade,
        Double weight,
        List<String> topicsCovered,
        String format,
        Boolean openBook,
        List<String> allowedMaterials,
        String preparationNotes
) implements DomainEvent {

    public static final String TYPE = "academic.exam.created";

    public ExamCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(examId, "examId");
        EventFields.required(title, "title");
        EventFields.required(courseId, "courseId");
        EventFields.required(examType, "examType");
        EventFields.required(date, "date");
        EventFields.required(durationMinutes, "durationMinutes");
        EventFields.required(location, "location");
        EventFields.required(pointsPossible, "pointsPossible");
        EventFields.required(weight, "weight");
        EventFields.required(format, "format");
        topicsCovered = EventFields.list(topicsCovered);
        openBook = EventFields.orDefault(openBook, Boolean.FALSE);
        allowedMaterials = EventFields.list(allowedMaterials);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
