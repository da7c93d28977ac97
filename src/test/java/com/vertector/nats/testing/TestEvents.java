package com.vertector.nats.testing;

import com.vertector.nats.event.AssignmentCreatedEvent;
import com.vertector.nats.event.AssignmentDeletedEvent;
import com.vertector.nats.event.AssignmentUpdatedEvent;
import com.vertector.nats.event.ChallengeAreaCreatedEvent;
import com.vertector.nats.event.ChallengeAreaDeletedEvent;
import com.vertector.nats.event.ChallengeAreaUpdatedEvent;
import com.vertector.nats.event.ClassScheduleCreatedEvent;
import com.vertector.nats.event.ClassScheduleDeletedEvent;
import com.vertector.nats.event.ClassScheduleUpdatedEvent;
import com.vertector.nats.event.CourseCreatedEvent;
import com.vertector.nats.event.CourseDeletedEvent;
import com.vertector.nats.event.CourseUpdatedEvent;
import com.vertector.nats.event.DomainEvent;
import com.vertector.nats.event.EventMetadata;
import com.vertector.nats.event.ExamCreatedEvent;
import com.vertector.nats.event.ExamDeletedEvent;
import com.vertector.nats.event.ExamUpdatedEvent;
import com.vertector.nats.event.LabSessionCreatedEvent;
import com.vertector.nats.event.LabSessionDeletedEvent;
import com.vertector.nats.event.LabSessionUpdatedEvent;
import com.vertector.nats.event.ProfileCreatedEvent;
import com.vertector.nats.event.ProfileEnrolledEvent;
import com.vertector.nats.event.ProfileUnenrolledEvent;
import com.vertector.nats.event.ProfileUpdatedEvent;
import com.vertector.nats.event.QuizCreatedEvent;
import com.vertector.nats.event.QuizDeletedEvent;
import com.vertector.nats.event.QuizUpdatedEvent;
import com.vertector.nats.event.StudyTodoCreatedEvent;
import com.vertector.nats.event.StudyTodoDeletedEvent;
import com.vertector.nats.event.StudyTodoUpdatedEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Sample events for tests. */
public final class TestEvents {

    public static final Instant T0 = Instant.parse("2025-01-15T10:30:00.123456Z");

    public static final EventMetadata METADATA = new EventMetadata(
            "test-service", "corr-1", "cause-1", "user-1", "inst-1", Map.of("traceparent", "00-abc-def-01"));

    private TestEvents() {
    }

    public static CourseCreatedEvent course(String courseId) {
        return course(courseId, "Intro to Computing");
    }

    public static CourseCreatedEvent course(String courseId, String description) {
        return new CourseCreatedEvent(null, null, T0, METADATA, courseId, "Computing " + courseId, "CS", "101",
                "Fall 2025", 4, description, "Ada Lovelace", "ada@example.edu", "inst-1",
                List.of("Lecture", "Lab"), List.of(), null, "https://example.edu/syllabus",
                List.of("Understand loops"), null);
    }

    public static ExamCreatedEvent exam(String examId) {
        return new ExamCreatedEvent(null, null, T0, METADATA, examId, "Midterm", "CS101", "stu-1", "Midterm",
                T0.plusSeconds(86_400), 90, "Hall A", 100, null, null, 25.0, List.of("Recursion"), "Written",
                null, List.of("Calculator"), null);
    }

    public static QuizCreatedEvent quiz(String quizId) {
        return new QuizCreatedEvent(null, null, T0, METADATA, quizId, "Quiz 1", "CS101", "stu-1", 1,
                T0.plusSeconds(3_600), 20, 10, null, null, 5.0, List.of("Loops"), null, null, null);
    }

    /** One instance of every catalog type, with optional fields populated. */
    public static List<DomainEvent> oneOfEach() {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("title", "Renamed");
        changes.put("credits", 3);
        changes.put("weight", 0.25);
        changes.put("tags", List.of("a", "b"));
        Map<String, Object> previous = new LinkedHashMap<>();
        previous.put("title", "Original");
        previous.put("credits", 4);
        previous.put("notes", null);

        Map<String, Object> rubricRow = new LinkedHashMap<>();
        rubricRow.put("criterion", "Correctness");
        rubricRow.put("points", 40);

        return List.of(
                new ProfileCreatedEvent(null, null, T0, METADATA, "stu-1", "stu@example.edu", "Grace", "Hopper",
                        "inst-1", "Computer Science", "Mathematics", 2, null, null, T0.minusSeconds(31_536_000L),
                        T0.plusSeconds(63_072_000L), 3.75, "+1-555-0100", "Parent", "Dr. Advisor",
                        "https://example.edu/p.png"),
                ProfileUpdatedEvent.of(METADATA, "stu-1", changes, previous),
                new ProfileEnrolledEvent(null, null, T0, METADATA, "stu-1", "CS101", T0, "Pass/Fail", null, 91.5, "A-"),
                new ProfileUnenrolledEvent(null, null, T0, METADATA, "stu-1", "CS101", T0, "Schedule conflict", null, null),
                course("CS101"),
                CourseUpdatedEvent.of(METADATA, "CS101", changes, previous),
                CourseDeletedEvent.of(METADATA, "CS101", "Cancelled"),
                new AssignmentCreatedEvent(null, null, T0, METADATA, "asg-1", "Homework 1", "CS101", "stu-1",
                        "Homework", "Implement a stack", T0.plusSeconds(604_800), 100, 92.0, 92.0, 0.1, null,
                        "https://example.edu/s", "https://example.edu/i", 6, "10% per day", List.of(rubricRow)),
                AssignmentUpdatedEvent.of(METADATA, "asg-1", changes, null),
                AssignmentDeletedEvent.of(METADATA, "asg-1", null),
                exam("exam-1"),
                ExamUpdatedEvent.of(METADATA, "exam-1", changes, previous),
                ExamDeletedEvent.of(METADATA, "exam-1", "Duplicate"),
                quiz("quiz-1"),
                QuizUpdatedEvent.of(METADATA, "quiz-1", changes, previous),
                QuizDeletedEvent.of(METADATA, "quiz-1", "Merged"),
                new LabSessionCreatedEvent(null, null, T0, METADATA, "lab-1", "Circuits", "PHY201", "stu-1", 3,
                        T0.plusSeconds(7_200), 120, "Lab 4", "Dr. Volta", "Ohm's law", List.of("Measure"),
                        "Chapter 3", T0.plusSeconds(3_600), List.of("Multimeter"), List.of("Goggles"),
                        T0.plusSeconds(172_800), 20, null),
                LabSessionUpdatedEvent.of(METADATA, "lab-1", changes, previous),
                LabSessionDeletedEvent.of(METADATA, "lab-1", "Lab closed"),
                new StudyTodoCreatedEvent(null, null, T0, METADATA, "todo-1", "Review notes", "stu-1", "CS101",
                        "Chapters 1-3", "High", null, T0.plusSeconds(86_400), 45, null, List.of("@library"),
                        null, T0, null, null, null, null),
                StudyTodoUpdatedEvent.of(METADATA, "todo-1", changes, previous),
                StudyTodoDeletedEvent.of(METADATA, "todo-1", "Done elsewhere"),
                new ChallengeAreaCreatedEvent(null, null, T0, METADATA, "ch-1", "Recursion", "stu-1", "CS101",
                        "Struggles with base cases", "Moderate", T0, "Grade trend", null, null,
                        List.of(0.5, 0.75, 0.625), 70, List.of("Recursion", "Induction"), "Practice daily"),
                ChallengeAreaUpdatedEvent.of(METADATA, "ch-1", changes, previous),
                ChallengeAreaDeletedEvent.of(METADATA, "ch-1", "Resolved"),
                new ClassScheduleCreatedEvent(null, null, T0, METADATA, "sch-1", "CS101", "inst-1",
                        List.of("Monday", "Wednesday"), LocalTime.of(9, 0), LocalTime.of(10, 15), "Science Hall",
                        "101", null, "In-Person", null, List.of("Tue 14:00-15:00"), "001", 120,
                        LocalDate.of(2025, 9, 1), LocalDate.of(2025, 12, 15)),
                ClassScheduleUpdatedEvent.of(METADATA, "sch-1", changes, previous),
                ClassScheduleDeletedEvent.of(METADATA, "sch-1", "Room change")
        );
    }
}
