package com.vertector.nats.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer instrumentation for publishing, consuming and the connection.
 *
 * <h3>Publishing</h3>
 * <ul>
 *   <li>{@code nats.events.published} (event_type, stream, status=success|failure)</li>
 *   <li>{@code nats.publish.duration} timer (event_type)</li>
 *   <li>{@code nats.publish.errors} (event_type, error_type)</li>
 *   <li>{@code nats.publish.retries} (event_type, attempt)</li>
 *   <li>{@code nats.event.payload.size} summary in bytes (event_type)</li>
 * </ul>
 *
 * <h3>Consuming</h3>
 * <ul>
 *   <li>{@code nats.events.consumed} (event_type, consumer, status=ack|nak|error)</li>
 *   <li>{@code nats.consume.duration} timer (event_type, consumer)</li>
 *   <li>{@code nats.consumer.errors} (consumer, error_type)</li>
 *   <li>{@code nats.consumer.processing} gauge of in-flight messages (consumer)</li>
 *   <li>{@code nats.consumer.lag} gauge of pending messages (stream, consumer)</li>
 * </ul>
 *
 * <h3>Connection and streams</h3>
 * <ul>
 *   <li>{@code nats.connection.status} gauge, 1 connected and 0 otherwise (client)</li>
 *   <li>{@code nats.reconnections} (client)</li>
 *   <li>{@code nats.stream.messages} and {@code nats.stream.bytes} gauges (stream)</li>
 * </ul>
 *
 * <p>Exposed through whatever registry backs the instance; with Spring Boot Actuator
 * and the Prometheus registry that is {@code /actuator/prometheus}.</p>
 */
public class EventMetrics {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";
    public static final String STATUS_ACK = "ack";
    public static final String STATUS_NAK = "nak";
    public static final String STATUS_ERROR = "error";

    private static final Duration[] PUBLISH_SLOS = {
            Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(25),
            Duration.ofMillis(50), Duration.ofMillis(100), Duration.ofMillis(250), Duration.ofMillis(500),
            Duration.ofSeconds(1), Duration.ofMillis(2500), Duration.ofSeconds(5)
    };

    private static final Duration[] CONSUME_SLOS = {
            Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofMillis(100), Duration.ofMillis(500),
            Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(30)
    };

    private static final double[] PAYLOAD_SLOS = {
            100, 500, 1_000, 5_000, 10_000, 50_000, 100_000, 500_000, 1_000_000
    };

    private final MeterRegistry registry;

    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> lag = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> connectionStatus = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> streamMessages = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> streamBytes = new ConcurrentHashMap<>();

    public EventMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Instance backed by an empty composite registry; every recording is dropped. */
    public static EventMetrics noop() {
        return new EventMetrics(new CompositeMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ---------------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------------

    public void recordPublishSuccess(String eventType, String stream, Duration elapsed) {
        Counter.builder("nats.events.published")
                .description("Events published")
                .tag("event_type", eventType)
                .tag("stream", stream)
                .tag("status", STATUS_SUCCESS)
                .register(registry)
                .increment();
        Timer.builder("nats.publish.duration")
                .description("Time to publish an event, retries included")
                .tag("event_type", eventType)
                .serviceLevelObjectives(PUBLISH_SLOS)
                .register(registry)
                .record(elapsed);
    }

    public void recordPublishFailure(String eventType, String stream) {
        Counter.builder("nats.events.published")
                .description("Events published")
                .tag("event_type", eventType)
                .tag("stream", stream)
                .tag("status", STATUS_FAILURE)
                .register(registry)
                .increment();
    }

    public void recordPublishError(String eventType, String errorType) {
        Counter.builder("nats.publish.errors")
                .description("Failed publish attempts")
                .tag("event_type", eventType)
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    /** {@code attempt} is the one-based number of the attempt about to be made. */
    public void recordPublishRetry(String eventType, int attempt) {
        Counter.builder("nats.publish.retries")
                .description("Publish retries")
                .tag("event_type", eventType)
                .tag("attempt", Integer.toString(attempt))
                .register(registry)
                .increment();
    }

    public void recordPayloadSize(String eventType, int bytes) {
        DistributionSummary.builder("nats.event.payload.size")
                .description("Encoded event size")
                .baseUnit("bytes")
                .tag("event_type", eventType)
                .serviceLevelObjectives(PAYLOAD_SLOS)
                .register(registry)
                .record(bytes);
    }

    // ---------------------------------------------------------------------
    // Consuming
    // ---------------------------------------------------------------------

    public void recordConsumed(String eventType, String consumer, String status) {
        Counter.builder("nats.events.consumed")
                .description("Events consumed")
                .tag("event_type", eventType)
                .tag("consumer", consumer)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordConsumeDuration(String eventType, String consumer, Duration elapsed) {
        Timer.builder("nats.consume.duration")
                .description("Time spent in the handler")
                .tag("event_type", eventType)
                .tag("consumer", consumer)
                .serviceLevelObjectives(CONSUME_SLOS)
                .register(registry)
                .record(elapsed);
    }

    public void recordConsumerError(String consumer, String errorType) {
        Counter.builder("nats.consumer.errors")
                .description("Consumer errors")
                .tag("consumer", consumer)
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    /**
     * Counter behind the in-flight gauge of {@code consumer}. Callers increment before
     * processing a message and decrement in a {@code finally} block.
     */
    public AtomicInteger inFlight(String consumer) {
        return inFlight.computeIfAbsent(consumer, c -> {
            AtomicInteger value = new AtomicInteger();
            Gauge.builder("nats.consumer.processing", value, AtomicInteger::get)
                    .description("Messages currently being processed")
                    .tag("consumer", c)
                    .register(registry);
            return value;
        });
    }

    public void recordConsumerLag(String stream, String consumer, long pending) {
        lag.computeIfAbsent(stream + '/' + consumer, k -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder("nats.consumer.lag", value, AtomicLong::get)
                    .description("Messages pending for the consumer")
                    .tag("stream", stream)
                    .tag("consumer", consumer)
                    .register(registry);
            return value;
        }).set(pending);
    }

    // ---------------------------------------------------------------------
    // Connection and streams
    // ---------------------------------------------------------------------

    public void recordConnectionStatus(String client, boolean connected) {
        connectionStatus.computeIfAbsent(client, c -> {
            AtomicInteger value = new AtomicInteger();
            Gauge.builder("nats.connection.status", value, AtomicInteger::get)
                    .description("1 when connected, 0 otherwise")
                    .tag("client", c)
                    .register(registry);
            return value;
        }).set(connected ? 1 : 0);
    }

    public void recordReconnect(String client) {
        Counter.builder("nats.reconnections")
                .description("Reconnections to the server")
                .tag("client", client)
                .register(registry)
                .increment();
    }

    public void recordStreamState(String stream, long messages, long bytes) {
        streamMessages.computeIfAbsent(stream, s -> gauge("nats.stream.messages", "Messages in the stream", s))
                .set(messages);
        streamBytes.computeIfAbsent(stream, s -> gauge("nats.stream.bytes", "Bytes in the stream", s))
                .set(bytes);
    }

    private AtomicLong gauge(String name, String description, String stream) {
        AtomicLong value = new AtomicLong();
        Gauge.builder(name, value, AtomicLong::get)
                .description(description)
                .tag("stream", stream)
                .register(registry);
        return value;
    }
}
