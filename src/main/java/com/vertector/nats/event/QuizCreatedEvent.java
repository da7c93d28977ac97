package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A quiz was scheduled. */
@JsonTypeName(QuizCreatedEvent.TYPE)
public record QuizCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String quizId,
        String title,
        String courseId,
        String studentId,
        Integer quizNumber,
        Instant date,
        Integer durationMinutes,
        Integer pointsPossible,
        Double pointsEarned,
        Double percentageGrade,
        Double weight,
        List<String> topicsCovered,
        String format,
        Integer attemptsAllowed,
        Boolean autoGraded
) implements DomainEvent {

    public static final String TYPE = "academic.quiz.created";

    public QuizCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(quizId, "quizId");
        EventFields.required(title, "title");
        EventFields.required(courseId, "courseId");
        EventFields.required(quizNumber, "quizNumber");
        EventFields.required(date, "date");
        EventFields.required(durationMinutes, "durationMinutes");
        EventFields.required(pointsPossible, "pointsPossible");
        EventFields.required(weight, "weight");
        topicsCovered = EventFields.list(topicsCovered);
        format = EventFields.orDefault(format, "Online");
        attemptsAllowed = EventFields.orDefault(attemptsAllowed, 1);
        autoGraded = EventFields.orDefault(autoGraded, Boolean.TRUE);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
