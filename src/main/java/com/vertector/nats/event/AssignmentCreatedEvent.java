package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An assignment was created, either for a whole class ({@code studentId} unset) or
 * for one student.
 */
@JsonTypeName(AssignmentCreatedEvent.TYPE)
public record AssignmentCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String assignmentId,
        String title,
        String courseId,
        String studentId,
        String type,
        String description,
        Instant dueDate,
        Integer pointsPossible,
        Double pointsEarned,
        Double percentageGrade,
        Double weight,
        String submissionStatus,
        String submissionUrl,
        String instructionsUrl,
        Integer estimatedHours,
        String latePenalty,
        List<Map<String, Object>> rubric
) implements DomainEvent {

    public static final String TYPE = "academic.assignment.created";

    public AssignmentCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(assignmentId, "assignmentId");
        EventFields.required(title, "title");
        EventFields.required(courseId, "courseId");
        EventFields.required(type, "type");
        EventFields.required(description, "description");
        EventFields.required(dueDate, "dueDate");
        EventFields.required(pointsPossible, "pointsPossible");
        EventFields.required(weight, "weight");
        submissionStatus = EventFields.orDefault(submissionStatus, "Not Started");
        rubric = EventFields.optionalList(rubric);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
