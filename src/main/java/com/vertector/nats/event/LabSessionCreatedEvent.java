package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A lab session was scheduled. */
@JsonTypeName(LabSessionCreatedEvent.TYPE)
public record LabSessionCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String labId,
        String title,
        String courseId,
        String studentId,
        Integer sessionNumber,
        Instant date,
        Integer durationMinutes,
        String location,
        String instructorName,
        String experimentTitle,
        List<String> objectives,
        String preLabReading,
        Instant preLabAssignmentDue,
        List<String> equipmentNeeded,
        List<String> safetyRequirements,
        Instant submissionDeadline,
        Integer pointsPossible,
        Double pointsEarned
) implements DomainEvent {

    public static final String TYPE = "academic.lab.created";

    public LabSessionCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(labId, "labId");
        EventFields.required(title, "title");
        EventFields.required(courseId, "courseId");
        EventFields.required(sessionNumber, "sessionNumber");
        EventFields.required(date, "date");
        EventFields.required(durationMinutes, "durationMinutes");
        EventFields.required(location, "location");
        EventFields.required(instructorName, "instructorName");
        EventFields.required(experimentTitle, "experimentTitle");
        objectives = EventFields.list(objectives);
        equipmentNeeded = EventFields.list(equipmentNeeded);
        safetyRequirements = EventFields.list(safetyRequirements);
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
