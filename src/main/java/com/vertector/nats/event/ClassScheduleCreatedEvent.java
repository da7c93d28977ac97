package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/** Meeting times and place of a course section for one term. */
@JsonTypeName(ClassScheduleCreatedEvent.TYPE)
public record ClassScheduleCreatedEvent(
        UUID eventId,
        String eventVersion,
        Instant timestamp,
        EventMetadata metadata,
        String scheduleId,
        String courseId,
        String institutionId,
        List<String> daysOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        String building,
        String room,
        String campus,
        String format,
        String meetingUrl,
        List<String> instructorOfficeHours,
        String sectionNumber,
        Integer enrollmentCapacity,
        LocalDate termStartDate,
        LocalDate termEndDate
) implements DomainEvent {

    public static final String TYPE = "academic.schedule.created";

    public ClassScheduleCreatedEvent {
        eventId = EventFields.eventId(eventId);
        eventVersion = EventFields.version(eventVersion);
        timestamp = EventFields.timestamp(timestamp);
        metadata = EventFields.metadata(metadata);
        EventFields.required(scheduleId, "scheduleId");
        EventFields.required(courseId, "courseId");
        EventFields.required(institutionId, "institutionId");
        daysOfWeek = EventFields.list(EventFields.required(daysOfWeek, "daysOfWeek"));
        EventFields.required(startTime, "startTime");
        EventFields.required(endTime, "endTime");
        EventFields.required(building, "building");
        EventFields.required(room, "room");
        campus = EventFields.orDefault(campus, "Main Campus");
        EventFields.required(format, "format");
        instructorOfficeHours = EventFields.list(instructorOfficeHours);
        EventFields.required(sectionNumber, "sectionNumber");
        EventFields.required(enrollmentCapacity, "enrollmentCapacity");
        EventFields.required(termStartDate, "termStartDate");
        EventFields.required(termEndDate, "termEndDate");
        if (termEndDate.isBefore(termStartDate)) {
            throw new IllegalArgumentException("termEndDate must not be before termStartDate");
        }
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
