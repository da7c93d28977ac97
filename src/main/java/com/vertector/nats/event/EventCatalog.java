package com.vertector.nats.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Type string to record class lookup for every event variant.
 *
 * <p>The type string is used for wire routing only (subject and {@code event_type}
 * discriminator). Handlers should switch on the record type, not on this map.</p>
 */
public final class EventCatalog {

    private static final Map<String, Class<? extends DomainEvent>> TYPES;

    static {
        Map<String, Class<? extends DomainEvent>> m = new LinkedHashMap<>();
        m.put(ProfileCreatedEvent.TYPE, ProfileCreatedEvent.class);
        m.put(ProfileUpdatedEvent.TYPE, ProfileUpdatedEvent.class);
        m.put(ProfileEnrolledEvent.TYPE, ProfileEnrolledEvent.class);
        m.put(ProfileUnenrolledEvent.TYPE, ProfileUnenrolledEvent.class);
        m.put(CourseCreatedEvent.TYPE, CourseCreatedEvent.class);
        m.put(CourseUpdatedEvent.TYPE, CourseUpdatedEvent.class);
        m.put(CourseDeletedEvent.TYPE, CourseDeletedEvent.class);
        m.put(AssignmentCreatedEvent.TYPE, AssignmentCreatedEvent.class);
        m.put(AssignmentUpdatedEvent.TYPE, AssignmentUpdatedEvent.class);
        m.put(AssignmentDeletedEvent.TYPE, AssignmentDeletedEvent.class);
        m.put(ExamCreatedEvent.TYPE, ExamCreatedEvent.class);
        m.put(ExamUpdatedEvent.TYPE, ExamUpdatedEvent.class);
        m.put(ExamDeletedEvent.TYPE, ExamDeletedEvent.class);
        m.put(QuizCreatedEvent.TYPE, QuizCreatedEvent.class);
        m.put(QuizUpdatedEvent.TYPE, QuizUpdatedEvent.class);
        m.put(QuizDeletedEvent.TYPE, QuizDeletedEvent.class);
        m.put(LabSessionCreatedEvent.TYPE, LabSessionCreatedEvent.class);
        m.put(LabSessionUpdatedEvent.TYPE, LabSessionUpdatedEvent.class);
        m.put(LabSessionDeletedEvent.TYPE, LabSessionDeletedEvent.class);
        m.put(StudyTodoCreatedEvent.TYPE, StudyTodoCreatedEvent.class);
        m.put(StudyTodoUpdatedEvent.TYPE, StudyTodoUpdatedEvent.class);
        m.put(StudyTodoDeletedEvent.TYPE, StudyTodoDeletedEvent.class);
        m.put(ChallengeAreaCreatedEvent.TYPE, ChallengeAreaCreatedEvent.class);
        m.put(ChallengeAreaUpdatedEvent.TYPE, ChallengeAreaUpdatedEvent.class);
        m.put(ChallengeAreaDeletedEvent.TYPE, ChallengeAreaDeletedEvent.class);
        m.put(ClassScheduleCreatedEvent.TYPE, ClassScheduleCreatedEvent.class);
        m.put(ClassScheduleUpdatedEvent.TYPE, ClassScheduleUpdatedEvent.class);
        m.put(ClassScheduleDeletedEvent.TYPE, ClassScheduleDeletedEvent.class);
        TYPES = Collections.unmodifiableMap(m);
    }

    private EventCatalog() {
    }

    /** All type strings, in catalog order. */
    public static Set<String> types() {
        return TYPES.keySet();
    }

    public static Optional<Class<? extends DomainEvent>> classFor(String eventType) {
        return Optional.ofNullable(TYPES.get(eventType));
    }

    public static boolean isKnown(String eventType) {
        return TYPES.containsKey(eventType);
    }
}
