package com.vertector.nats.consumer;

import com.vertector.nats.codec.EventCodec;
import com.vertector.nats.codec.EventDecodingException;
import com.vertector.nats.config.ConsumerDefinition;
import com.vertector.nats.config.MultiFilterStrategy;
import com.vertector.nats.event.DomainEvent;
import com.vertector.nats.metrics.EventMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pull consumer bound to one durable cursor.
 *
 * <h2>Lifecycle</h2>
 * {@code CREATED -> SUBSCRIBING -> RUNNING -> STOPPING -> STOPPED}. An instance is
 * subscribed at most once; {@code STOPPED} is terminal.
 *
 * <h2>Loop</h2>
 * <ul>
 *   <li>Fetch up to {@code batchSize} messages, waiting at most {@code fetchTimeout}.
 *       An empty fetch is an idle poll.</li>
 *   <li>Process the batch in delivery order: decode, then call the handler.</li>
 *   <li>Undecodable payloads are {@code nak}ed without reaching the handler.</li>
 *   <li>A throwing handler gets its message {@code nak}ed; the loop carries on. Any
 *       other runtime failure while processing a message is treated the same way.</li>
 *   <li>Fetch failures are logged and followed by a short pause. The loop ends only when
 *       the consumer is stopped, the thread is interrupted, or the subscription is no
 *       longer active.</li>
 * </ul>
 *
 * <h2>Filters</h2>
 * With more than one filter subject, {@link MultiFilterStrategy#SERVER_SIDE} leaves the
 * filtering to the cursor configuration while {@link MultiFilterStrategy#CLIENT_VERIFIED}
 * also checks every delivered subject and terminates messages matching none of them.
 *
 * <h2>Shutdown</h2>
 * The subscription is released on a bounded-elastic worker and waited for at most the
 * grace period, also when the loop ends with an error. It is released exactly once,
 * whichever of {@link #stop} and {@link #subscribe} gets to it first. Teardown failures
 * and timeouts are logged, never thrown.
 */
public class EventConsumer {

    private static final Logger log = LoggerFactory.getLogger(EventConsumer.class);

    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    static final Duration DEFAULT_FETCH_ERROR_PAUSE = Duration.ofSeconds(1);
    static final String ERROR_TYPE_DECODE = "DecodeError";
    static final String ERROR_TYPE_FILTER_MISMATCH = "FilterMismatch";

    private final CursorProvider provider;
    private final EventCodec codec;
    private final ConsumerDefinition definition;
    private final EventMetrics metrics;
    private final Duration fetchErrorPause;
    private final boolean clientVerified;

    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.CREATED);
    private volatile boolean running;
    private final AtomicReference<PullCursor> cursor = new AtomicReference<>();

    public EventConsumer(CursorProvider provider, EventCodec codec, ConsumerDefinition definition, EventMetrics metrics) {
        this(provider, codec, definition, metrics, DEFAULT_FETCH_ERROR_PAUSE);
    }

    EventConsumer(CursorProvider provider,
                  EventCodec codec,
                  ConsumerDefinition definition,
                  EventMetrics metrics,
                  Duration fetchErrorPause) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.fetchErrorPause = Objects.requireNonNull(fetchErrorPause, "fetchErrorPause");
        this.clientVerified = definition.filterSubjects().size() > 1
                && definition.multiFilterStrategy() == MultiFilterStrategy.CLIENT_VERIFIED;
    }

    public ConsumerState state() {
        return state.get();
    }

    public boolean isRunning() {
        return running;
    }

    public ConsumerDefinition definition() {
        return definition;
    }

    /**
     * Binds the durable cursor and runs the fetch loop on the calling thread until the
     * consumer is stopped.
     *
     * @param handler                 application callback
     * @param gracefulShutdownTimeout bound on teardown; {@code null} means
     *                                {@link #DEFAULT_SHUTDOWN_GRACE}
     * @throws IllegalStateException       if this consumer was already subscribed or stopped
     * @throws ConsumerException           if the cursor cannot be created or bound
     * @throws ConsumerCancelledException  if the calling thread was interrupted
     */
    public void subscribe(EventHandler handler, Duration gracefulShutdownTimeout) {
        Objects.requireNonNull(handler, "handler");
        Duration grace = gracefulShutdownTimeout == null ? DEFAULT_SHUTDOWN_GRACE : gracefulShutdownTimeout;
        String durable = definition.durableName();

        if (!state.compareAndSet(ConsumerState.CREATED, ConsumerState.SUBSCRIBING)) {
            throw new IllegalStateException("Consumer durable=" + durable + " cannot subscribe in state " + state.get());
        }

        PullCursor opened;
        try {
            boolean created = provider.ensureDurable(definition);
            if (created) {
                log.info("Created new consumer stream={} durable={}", definition.stream(), durable);
            } else {
                log.info("Using existing consumer stream={} durable={}", definition.stream(), durable);
            }
            logFilterMode();
            opened = provider.open(definition);
        } catch (InterruptedException e) {
            state.set(ConsumerState.STOPPED);
            Thread.currentThread().interrupt();
            throw new ConsumerCancelledException("Consumer durable=" + durable + " cancelled while subscribing");
        } catch (Exception e) {
            state.set(ConsumerState.STOPPED);
            log.error("Subscribe failed stream={} durable={} err={}", definition.stream(), durable, e.toString());
            throw new ConsumerException("Failed to subscribe durable=" + durable + " on stream=" + definition.stream(), e);
        }

        cursor.set(opened);
        running = true;
        if (!state.compareAndSet(ConsumerState.SUBSCRIBING, ConsumerState.RUNNING)) {
            // stop() won the race while the cursor was being bound
            running = false;
            PullCursor unreleased = cursor.getAndSet(null);
            if (unreleased != null) {
                release(unreleased, grace);
            }
            state.set(ConsumerState.STOPPED);
            return;
        }
        log.info("Subscribed stream={} durable={} filters={} batchSize={}",
                definition.stream(), durable, definition.filterSubjects(), definition.batchSize());

        boolean interrupted;
        try {
            interrupted = runLoop(handler, opened);
        } finally {
            shutdown(grace);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
            throw new ConsumerCancelledException("Consumer durable=" + durable + " cancelled");
        }
    }

    /**
     * Runs {@link #subscribe} on a bounded-elastic worker. Disposing the result stops the
     * consumer.
     */
    public Disposable start(EventHandler handler, Duration gracefulShutdownTimeout) {
        Duration grace = gracefulShutdownTimeout == null ? DEFAULT_SHUTDOWN_GRACE : gracefulShutdownTimeout;
        return Mono.fromRunnable(() -> {
                    try {
                        subscribe(handler, grace);
                    } catch (ConsumerCancelledException e) {
                        log.info("Consumer durable={} cancelled", definition.durableName());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> stop(grace))
                .subscribe(
                        v -> { },
                        err -> log.error("Consumer durable={} terminated: {}", definition.durableName(), err.toString(), err)
                );
    }

    public void stop() {
        stop(DEFAULT_SHUTDOWN_GRACE);
    }

    /**
     * Stops the loop and releases the subscription, waiting at most {@code grace}.
     * Safe to call from any thread and more than once.
     */
    public void stop(Duration grace) {
        shutdown(grace == null ? DEFAULT_SHUTDOWN_GRACE : grace);
    }

    private void shutdown(Duration grace) {
        ConsumerState previous = state.getAndUpdate(s -> s == ConsumerState.STOPPED ? s : ConsumerState.STOPPING);
        if (previous == ConsumerState.STOPPING || previous == ConsumerState.STOPPED) {
            return;
        }
        running = false;
        log.info("Stopping consumer durable={} previousState={}", definition.durableName(), previous);

        PullCursor c = cursor.getAndSet(null);
        if (c != null) {
            release(c, grace);
        }
        state.set(ConsumerState.STOPPED);
        log.info("Consumer stopped durable={}", definition.durableName());
    }

    private void release(PullCursor c, Duration grace) {
        // block() fails fast on an interrupted thread; the caller restores the flag
        boolean wasInterrupted = Thread.interrupted();
        try {
            Mono.fromCallable(() -> {
                        c.unsubscribe();
                        return Boolean.TRUE;
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(grace)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.warn("Unsubscribe did not finish within {} ms durable={}", grace.toMillis(), definition.durableName());
            } else {
                log.error("Unsubscribe failed durable={} err={}", definition.durableName(), cause.toString(), cause);
            }
        } finally {
            if (wasInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** @return {@code true} if the loop ended because the thread was interrupted */
    private boolean runLoop(EventHandler handler, PullCursor c) {
        String durable = definition.durableName();
        while (running) {
            if (Thread.interrupted()) {
                return true;
            }
            if (!c.isActive()) {
                log.warn("Subscription no longer active durable={}; leaving fetch loop", durable);
                return false;
            }

            List<DeliveredMessage> batch;
            try {
                batch = c.fetch(definition.batchSize(), definition.fetchTimeout());
            } catch (InterruptedException e) {
                return true;
            } catch (Exception e) {
                if (!running) {
                    break;
                }
                metrics.recordConsumerError(durable, e.getClass().getSimpleName());
                log.warn("Fetch failed durable={} pauseMs={} err={}", durable, fetchErrorPause.toMillis(), e.toString());
                if (!pause()) {
                    return true;
                }
                continue;
            }

            if (batch.isEmpty()) {
                log.trace("No messages durable={}", durable);
                continue;
            }
            for (DeliveredMessage message : batch) {
                boolean interrupted;
                try {
                    interrupted = process(handler, message);
                } catch (RuntimeException e) {
                    log.error("Unexpected failure processing message durable={} subject={}", durable, message.subject(), e);
                    metrics.recordConsumerError(durable, e.getClass().getSimpleName());
                    settle(message, false);
                    continue;
                }
                if (interrupted) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean pause() {
        try {
            TimeUnit.NANOSECONDS.sleep(fetchErrorPause.toNanos());
            return true;
        } catch (InterruptedException e) {
            return false;
        }
    }

    /** @return {@code true} if the handler was interrupted */
    private boolean process(EventHandler handler, DeliveredMessage message) {
        String durable = definition.durableName();
        AtomicInteger inFlight = metrics.inFlight(durable);
        inFlight.incrementAndGet();
        try {
            long pending = message.pending();
            if (pending >= 0) {
                metrics.recordConsumerLag(definition.stream(), durable, pending);
            }

            if (clientVerified && !SubjectMatcher.matchesAny(definition.filterSubjects(), message.subject())) {
                log.warn("Terminating message outside filters durable={} subject={} filters={}",
                        durable, message.subject(), definition.filterSubjects());
                metrics.recordConsumerError(durable, ERROR_TYPE_FILTER_MISMATCH);
                settle(message, true);
                return false;
            }

            DomainEvent event;
            try {
                event = codec.decode(message.data());
            } catch (EventDecodingException e) {
                log.error("Undecodable message durable={} subject={} delivery={} err={}",
                        durable, message.subject(), message.deliveryCount(), e.getMessage());
                metrics.recordConsumed(message.subject(), durable, EventMetrics.STATUS_NAK);
                metrics.recordConsumerError(durable, ERROR_TYPE_DECODE);
                settle(message, false);
                return false;
            }

            String type = event.eventType();
            long started = System.nanoTime();
            try {
                handler.handle(event, message);
                metrics.recordConsumed(type, durable, EventMetrics.STATUS_ACK);
                log.debug("Handled event id={} type={} durable={}", event.eventId(), type, durable);
                return false;
            } catch (InterruptedException e) {
                log.warn("Handler interrupted event id={} type={} durable={}", event.eventId(), type, durable);
                metrics.recordConsumed(type, durable, EventMetrics.STATUS_ERROR);
                settle(message, false);
                return true;
            } catch (Exception e) {
                log.error("Handler failed event id={} type={} durable={} delivery={}",
                        event.eventId(), type, durable, message.deliveryCount(), e);
                metrics.recordConsumed(type, durable, EventMetrics.STATUS_ERROR);
                metrics.recordConsumerError(durable, e.getClass().getSimpleName());
                settle(message, false);
                return false;
            } finally {
                metrics.recordConsumeDuration(type, durable, Duration.ofNanos(System.nanoTime() - started));
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void settle(DeliveredMessage message, boolean terminate) {
        try {
            if (terminate) {
                message.term();
            } else {
                message.nak();
            }
        } catch (RuntimeException e) {
            log.warn("Could not {} message durable={} subject={} err={}",
                    terminate ? "term" : "nak", definition.durableName(), message.subject(), e.toString());
        }
    }

    private void logFilterMode() {
        List<String> filters = definition.filterSubjects();
        if (filters.size() <= 1) {
            return;
        }
        if (clientVerified) {
            log.info("Multiple filter subjects durable={} filters={}; delivered subjects are verified client-side",
                    definition.durableName(), filters);
        } else {
            log.info("Multiple filter subjects durable={} filters={}; relying on server-side filtering only",
                    definition.durableName(), filters);
        }
    }
}
