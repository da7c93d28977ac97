package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A study todo was created, by the student or generated from an assignment or a
 * detected challenge ({@code source}).
 */
@JsonTypeName(StudyTodoCreatedEvent.TYPE)
public record StudyTodoCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String todoId,
        String title,
        String studentId,
        String courseId,
        String description,
        String priority,
        String status,
        Instant dueDate,
        Integer estimatedMinutes,
        Integer actualMinutes,
        List<String> context,
        String energyRequired,
        Instant createdDate,
        Instant completedDate,
        String recurrence,
        Boolean aiGenerated,
        String source
) implements DomainEvent {

    public static final String TYPE = "academic.study.created";

    public StudyTodoCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(todoId, "todoId");
        EventFields.required(title, "title");
        EventFields.required(studentId, "studentId");
        EventFields.required(description, "description");
        EventFields.required(priority, "priority");
        EventFields.required(estimatedMinutes, "estimatedMinutes");
        status = EventFields.orDefault(status, "Next Action");
        context = EventFields.list(context);
        energyRequired = EventFields.orDefault(energyRequired, "Medium");
        createdDate = createdDate == null ? Instant.now() : createdDate;
        recurrence = EventFields.orDefault(recurrence, "None");
        aiGenerated = EventFields.orDefault(aiGenerated, Boolean.FALSE);
        source = EventFields.orDefault(source, "User");
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
