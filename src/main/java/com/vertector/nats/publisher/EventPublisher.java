package com.vertector.nats.publisher;

import com.vertector.nats.codec.EventCodec;
import com.vertector.nats.config.PublisherSettings;
import com.vertector.nats.event.DomainEvent;
import com.vertector.nats.metrics.EventMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes {@link DomainEvent}s to JetStream.
 *
 * <h2>Publish flow</h2>
 * <ul>
 *   <li>Encode the event and reject it before any write when the payload is larger than
 *       {@link PublisherSettings#maxPayloadBytes()}.</li>
 *   <li>Route it to the subject equal to its event type.</li>
 *   <li>Attach identity headers ({@value #HEADER_EVENT_ID}, {@value #HEADER_EVENT_VERSION},
 *       {@value #HEADER_SOURCE_SERVICE} and, when present, {@value #HEADER_CORRELATION_ID}).
 *       Caller headers with the same names are overwritten.</li>
 *   <li>Use the event id as the JetStream message id so the server drops duplicates
 *       within its de-duplication window.</li>
 *   <li>Make up to {@link PublisherSettings#maxRetries()} attempts, sleeping
 *       {@code base^i} seconds after the i-th failed attempt (0-based). Nothing is slept
 *       after the last attempt.</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link EventValidationException}: the event was never sent.</li>
 *   <li>{@link PublishException}: retries exhausted, a permanent broker error, or the
 *       calling thread was interrupted (its interrupt flag is restored).</li>
 * </ul>
 *
 * <p>The blocking methods run on the caller's thread. {@link #publishAsync} and parallel
 * batches run on {@link Schedulers#boundedElastic()}.</p>
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    public static final String HEADER_EVENT_ID = "event-id";
    public static final String HEADER_EVENT_VERSION = "event-version";
    public static final String HEADER_SOURCE_SERVICE = "source-service";
    public static final String HEADER_CORRELATION_ID = "correlation-id";
    public static final String HEADER_REPLY_TO = "reply-to";

    static final String UNKNOWN_STREAM = "unknown";

    private final StreamWriter writer;
    private final EventCodec codec;
    private final PublisherSettings settings;
    private final EventMetrics metrics;
    private final PublishErrorClassifier classifier;
    private final Sleeper sleeper;

    public EventPublisher(StreamWriter writer, EventCodec codec, PublisherSettings settings, EventMetrics metrics) {
        this(writer, codec, settings, metrics, new PublishErrorClassifier(), Sleeper.threadSleep());
    }

    public EventPublisher(StreamWriter writer,
                          EventCodec codec,
                          PublisherSettings settings,
                          EventMetrics metrics,
                          PublishErrorClassifier classifier,
                          Sleeper sleeper) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public PubAck publish(DomainEvent event) {
        return publish(event, Map.of(), null);
    }

    public PubAck publish(DomainEvent event, Map<String, String> headers) {
        return publish(event, headers, null);
    }

    /**
     * Publishes one event and blocks until the stream acknowledges it.
     *
     * @param event   event to publish
     * @param headers extra headers, may be {@code null}
     * @param timeout per-attempt timeout; {@code null} means the configured default
     * @return the acknowledgment of the successful attempt
     */
    public PubAck publish(DomainEvent event, Map<String, String> headers, Duration timeout) {
        Objects.requireNonNull(event, "event");
        return send(event, mergeHeaders(event, headers, null), timeout);
    }

    /** Non-blocking variant of {@link #publish(DomainEvent, Map, Duration)}. */
    public Mono<PubAck> publishAsync(DomainEvent event, Map<String, String> headers, Duration timeout) {
        return Mono.fromCallable(() -> publish(event, headers, timeout))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public List<PubAck> publishBatch(List<? extends DomainEvent> events) {
        return publishBatch(events, Map.of(), null, true);
    }

    /**
     * Publishes several events with the same headers and timeout.
     *
     * <p>Acknowledgments are returned in input order. In parallel mode the events are
     * published concurrently and the first failure is rethrown once every publish has
     * settled or been cancelled; in sequential mode publishing stops at the first
     * failure. An empty list returns an empty list without touching the broker.</p>
     */
    public List<PubAck> publishBatch(List<? extends DomainEvent> events,
                                     Map<String, String> headers,
                                     Duration timeout,
                                     boolean parallel) {
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return List.of();
        }
        log.debug("Publishing batch size={} parallel={}", events.size(), parallel);

        if (!parallel) {
            List<PubAck> acks = new ArrayList<>(events.size());
            for (DomainEvent event : events) {
                acks.add(publish(event, headers, timeout));
            }
            return acks;
        }

        List<PubAck> acks = Flux.fromIterable(events)
                .flatMapSequential(event -> publishAsync(event, headers, timeout))
                .collectList()
                .block();
        return acks == null ? List.of() : acks;
    }

    public PubAck publishWithReply(DomainEvent event, String replySubject) {
        return publishWithReply(event, replySubject, Map.of(), null);
    }

    /**
     * Publishes with a {@value #HEADER_REPLY_TO} header naming where responders should
     * answer. The acknowledgment is the stream's, not a responder's reply.
     */
    public PubAck publishWithReply(DomainEvent event, String replySubject, Map<String, String> headers, Duration timeout) {
        Objects.requireNonNull(event, "event");
        if (replySubject == null || replySubject.isBlank()) {
            throw new EventValidationException("replySubject must not be blank");
        }
        return send(event, mergeHeaders(event, headers, replySubject), timeout);
    }

    private PubAck send(DomainEvent event, Map<String, String> headers, Duration timeout) {
        String type = event.eventType();
        byte[] payload = codec.encode(event);
        metrics.recordPayloadSize(type, payload.length);
        if (payload.length > settings.maxPayloadBytes()) {
            metrics.recordPublishError(type, PayloadTooLargeException.class.getSimpleName());
            throw new PayloadTooLargeException(event.eventId(), type, payload.length, settings.maxPayloadBytes());
        }

        OutboundMessage message = new OutboundMessage(type, payload, headers, event.eventId().toString());
        Duration effectiveTimeout = timeout == null ? settings.defaultTimeout() : timeout;
        int maxAttempts = settings.maxRetries();
        long started = System.nanoTime();
        Exception last = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                metrics.recordPublishRetry(type, attempt + 1);
            }
            try {
                PubAck ack = writer.write(message, effectiveTimeout);
                metrics.recordPublishSuccess(type, ack.stream(), Duration.ofNanos(System.nanoTime() - started));
                log.info("Published event id={} subject={} stream={} seq={} duplicate={}",
                        event.eventId(), type, ack.stream(), ack.sequence(), ack.duplicate());
                return ack;
            } catch (InterruptedException e) {
                throw interrupted(event, attempt + 1, e);
            } catch (Exception e) {
                last = e;
                metrics.recordPublishError(type, e.getClass().getSimpleName());

                if (!classifier.isRetryable(e)) {
                    metrics.recordPublishFailure(type, UNKNOWN_STREAM);
                    log.error("Publish rejected id={} subject={} attempt={}/{} error={}",
                            event.eventId(), type, attempt + 1, maxAttempts, e.toString());
                    throw new PublishException("Publish of event id=" + event.eventId() + " type=" + type
                            + " failed with a non-retryable error", e, event.eventId(), type, attempt + 1);
                }

                if (attempt < maxAttempts - 1) {
                    Duration backoff = settings.backoffAfter(attempt);
                    log.warn("Publish failed id={} subject={} attempt={}/{} retryInMs={} error={}",
                            event.eventId(), type, attempt + 1, maxAttempts, backoff.toMillis(), e.toString());
                    try {
                        sleeper.sleep(backoff);
                    } catch (InterruptedException ie) {
                        throw interrupted(event, attempt + 1, ie);
                    }
                }
            }
        }

        metrics.recordPublishFailure(type, UNKNOWN_STREAM);
        log.error("Publish failed id={} subject={} after {} attempts", event.eventId(), type, maxAttempts, last);
        throw new PublishException("Failed to publish event id=" + event.eventId() + " type=" + type
                + " after " + maxAttempts + " attempts", last, event.eventId(), type, maxAttempts);
    }

    private PublishException interrupted(DomainEvent event, int attempts, InterruptedException e) {
        Thread.currentThread().interrupt();
        metrics.recordPublishFailure(event.eventType(), UNKNOWN_STREAM);
        log.warn("Publish interrupted id={} subject={} attempt={}", event.eventId(), event.eventType(), attempts);
        return new PublishException("Interrupted while publishing event id=" + event.eventId(),
                e, event.eventId(), event.eventType(), attempts);
    }

    private static Map<String, String> mergeHeaders(DomainEvent event, Map<String, String> callerHeaders, String replySubject) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (callerHeaders != null) {
            merged.putAll(callerHeaders);
        }
        if (replySubject != null) {
            merged.put(HEADER_REPLY_TO, replySubject);
        }
        merged.put(HEADER_EVENT_ID, event.eventId().toString());
        merged.put(HEADER_EVENT_VERSION, event.eventVersion());
        merged.put(HEADER_SOURCE_SERVICE, event.metadata().sourceService());
        String correlationId = event.metadata().correlationId();
        if (correlationId != null) {
            merged.put(HEADER_CORRELATION_ID, correlationId);
        }
        return merged;
    }
}
