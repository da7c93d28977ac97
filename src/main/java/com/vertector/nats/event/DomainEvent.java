package com.vertector.nats.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable, versioned fact published to the broker.
 *
 * <h2>Envelope</h2>
 * <ul>
 *   <li>{@link #eventId()}: unique per logical occurrence; doubles as the JetStream
 *       message id so retried publishes are de-duplicated by the server.</li>
 *   <li>{@link #eventType()}: dotted type string, stable per record class. It is the
 *       publish subject and the {@code event_type} discriminator on the wire, and
 *       nothing else.</li>
 *   <li>{@link #eventVersion()}: schema version, {@code "1.0"} unless set.</li>
 *   <li>{@link #timestamp()}: creation instant (UTC).</li>
 *   <li>{@link #metadata()}: correlation and tracing context.</li>
 * </ul>
 *
 * <h2>Catalog</h2>
 * The set of variants is closed. Each variant is a record carrying its own required
 * and optional fields; {@link EventCatalog} lists them by type string.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProfileCreatedEvent.class, name = ProfileCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = ProfileUpdatedEvent.class, name = ProfileUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = ProfileEnrolledEvent.class, name = ProfileEnrolledEvent.TYPE),
        @JsonSubTypes.Type(value = ProfileUnenrolledEvent.class, name = ProfileUnenrolledEvent.TYPE),
        @JsonSubTypes.Type(value = CourseCreatedEvent.class, name = CourseCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = CourseUpdatedEvent.class, name = CourseUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = CourseDeletedEvent.class, name = CourseDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = AssignmentCreatedEvent.class, name = AssignmentCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = AssignmentUpdatedEvent.class, name = AssignmentUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = AssignmentDeletedEvent.class, name = AssignmentDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = ExamCreatedEvent.class, name = ExamCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = ExamUpdatedEvent.class, name = ExamUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = ExamDeletedEvent.class, name = ExamDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = QuizCreatedEvent.class, name = QuizCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = QuizUpdatedEvent.class, name = QuizUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = QuizDeletedEvent.class, name = QuizDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = LabSessionCreatedEvent.class, name = LabSessionCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = LabSessionUpdatedEvent.class, name = LabSessionUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = LabSessionDeletedEvent.class, name = LabSessionDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = StudyTodoCreatedEvent.class, name = StudyTodoCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = StudyTodoUpdatedEvent.class, name = StudyTodoUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = StudyTodoDeletedEvent.class, name = StudyTodoDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = ChallengeAreaCreatedEvent.class, name = ChallengeAreaCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = ChallengeAreaUpdatedEvent.class, name = ChallengeAreaUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = ChallengeAreaDeletedEvent.class, name = ChallengeAreaDeletedEvent.TYPE),
        @JsonSubTypes.Type(value = ClassScheduleCreatedEvent.class, name = ClassScheduleCreatedEvent.TYPE),
        @JsonSubTypes.Type(value = ClassScheduleUpdatedEvent.class, name = ClassScheduleUpdatedEvent.TYPE),
        @JsonSubTypes.Type(value = ClassScheduleDeletedEvent.class, name = ClassScheduleDeletedEvent.TYPE)
})
public sealed interface DomainEvent permits
        ProfileCreatedEvent, ProfileUpdatedEvent, ProfileEnrolledEvent, ProfileUnenrolledEvent,
        CourseCreatedEvent, CourseUpdatedEvent, CourseDeletedEvent,
        AssignmentCreatedEvent, AssignmentUpdatedEvent, AssignmentDeletedEvent,
        ExamCreatedEvent, ExamUpdatedEvent, ExamDeletedEvent,
        QuizCreatedEvent, QuizUpdatedEvent, QuizDeletedEvent,
        LabSessionCreatedEvent, LabSessionUpdatedEvent, LabSessionDeletedEvent,
        StudyTodoCreatedEvent, StudyTodoUpdatedEvent, StudyTodoDeletedEvent,
        ChallengeAreaCreatedEvent, ChallengeAreaUpdatedEvent, ChallengeAreaDeletedEvent,
        ClassScheduleCreatedEvent, ClassScheduleUpdatedEvent, ClassScheduleDeletedEvent {

    UUID eventId();

    String eventType();

    String eventVersion();

    Instant timestamp();

    EventMetadata metadata();
}
