package com.vertector.nats.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EventMetricsTest {

    private SimpleMeterRegistry registry;
    private EventMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EventMetrics(registry);
    }

    @Test
    void publishOutcomesAreTaggedByStatus() {
        metrics.recordPublishSuccess("academic.course.created", "ACADEMIC_EVENTS", Duration.ofMillis(12));
        metrics.recordPublishSuccess("academic.course.created", "ACADEMIC_EVENTS", Duration.ofMillis(8));
        metrics.recordPublishFailure("academic.course.created", "unknown");

        assertThat(registry.get("nats.events.published").tags("status", "success", "stream", "ACADEMIC_EVENTS")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("nats.events.published").tags("status", "failure").counter().count()).isEqualTo(1.0);
        Timer timer = registry.get("nats.publish.duration").tag("event_type", "academic.course.created").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(20.0);
    }

    @Test
    void payloadSizesAreSummarized() {
        metrics.recordPayloadSize("academic.exam.created", 400);
        metrics.recordPayloadSize("academic.exam.created", 600);

        assertThat(registry.get("nats.event.payload.size").summary().totalAmount()).isEqualTo(1000.0);
        assertThat(registry.get("nats.event.payload.size").summary().getId().getBaseUnit()).isEqualTo("bytes");
    }

    @Test
    void inFlightGaugeIsSharedPerConsumer() {
        AtomicInteger first = metrics.inFlight("schedule");
        AtomicInteger again = metrics.inFlight("schedule");
        first.incrementAndGet();

        assertThat(again).isSameAs(first);
        assertThat(registry.get("nats.consumer.processing").tag("consumer", "schedule").gauge().value()).isEqualTo(1.0);
        assertThat(metrics.inFlight("grades").get()).isZero();
    }

    @Test
    void gaugesHoldTheLatestValue() {
        metrics.recordConsumerLag("ACADEMIC_EVENTS", "schedule", 42);
        metrics.recordConsumerLag("ACADEMIC_EVENTS", "schedule", 7);
        metrics.recordStreamState("ACADEMIC_EVENTS", 100, 2048);
        metrics.recordConnectionStatus("svc", true);
        metrics.recordConnectionStatus("svc", false);

        assertThat(registry.get("nats.consumer.lag").gauge().value()).isEqualTo(7.0);
        assertThat(registry.get("nats.stream.messages").tag("stream", "ACADEMIC_EVENTS").gauge().value()).isEqualTo(100.0);
        assertThat(registry.get("nats.stream.bytes").gauge().value()).isEqualTo(2048.0);
        assertThat(registry.get("nats.connection.status").tag("client", "svc").gauge().value()).isZero();
    }

    @Test
    void errorsAndRetriesAreCounted() {
        metrics.recordPublishError("academic.quiz.created", "IOException");
        metrics.recordPublishRetry("academic.quiz.created", 2);
        metrics.recordConsumerError("schedule", "DecodeError");
        metrics.recordConsumed("academic.quiz.created", "schedule", EventMetrics.STATUS_ACK);
        metrics.recordConsumeDuration("academic.quiz.created", "schedule", Duration.ofMillis(3));
        metrics.recordReconnect("svc");

        assertThat(registry.get("nats.publish.errors").tag("error_type", "IOException").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("nats.publish.retries").tag("attempt", "2").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("nats.consumer.errors").tag("error_type", "DecodeError").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("nats.events.consumed").tag("status", "ack").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("nats.consume.duration").timer().count()).isEqualTo(1);
        assertThat(registry.get("nats.reconnections").counter().count()).isEqualTo(1.0);
    }

    @Test
    void noopDropsEverything() {
        EventMetrics noop = EventMetrics.noop();
        noop.recordPublishError("t", "e");
        noop.inFlight("c").incrementAndGet();

        assertThat(noop.registry()).isInstanceOfSatisfying(CompositeMeterRegistry.class,
                composite -> assertThat(composite.getRegistries()).isEmpty());
    }
}
