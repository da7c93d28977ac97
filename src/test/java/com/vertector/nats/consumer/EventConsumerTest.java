package com.vertector.nats.consumer;

import com.vertector.nats.codec.EventCodec;
import com.vertector.nats.config.ConsumerDefinition;
import com.vertector.nats.config.MultiFilterStrategy;
import com.vertector.nats.event.CourseCreatedEvent;
import com.vertector.nats.event.DomainEvent;
import com.vertector.nats.metrics.EventMetrics;
import com.vertector.nats.testing.Await;
import com.vertector.nats.testing.InMemoryBroker;
import com.vertector.nats.testing.Stubs;
import com.vertector.nats.testing.TestEvents;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventConsumerTest {

    private static final String DURABLE = "schedule-service";
    private static final Duration FETCH_TIMEOUT = Duration.ofMillis(50);

    private final EventCodec codec = new EventCodec();

    private SimpleMeterRegistry registry;
    private EventMetrics metrics;
    private InMemoryBroker broker;

    private final List<EventConsumer> consumers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private final AtomicReference<Throwable> loopFailure = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EventMetrics(registry);
        broker = new InMemoryBroker();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (EventConsumer consumer : consumers) {
            consumer.stop(Duration.ofSeconds(1));
        }
        for (Thread thread : threads) {
            thread.interrupt();
            thread.join(5_000);
        }
    }

    private static ConsumerDefinition definition(String durable, List<String> filters) {
        return ConsumerDefinition.of(InMemoryBroker.STREAM, durable, filters).withBatch(10, FETCH_TIMEOUT);
    }

    private static ConsumerDefinition definition() {
        return definition(DURABLE, List.of("academic.>"));
    }

    private EventConsumer consumer(ConsumerDefinition def) {
        EventConsumer consumer = new EventConsumer(broker, codec, def, metrics, Duration.ofMillis(20));
        consumers.add(consumer);
        return consumer;
    }

    private Thread subscribeInBackground(EventConsumer consumer, EventHandler handler, Duration grace) {
        Thread thread = new Thread(() -> {
            try {
                consumer.subscribe(handler, grace);
            } catch (ConsumerCancelledException e) {
                // interrupted on purpose by the test
            } catch (RuntimeException e) {
                loopFailure.set(e);
            }
        }, "consumer-" + consumer.definition().durableName());
        threads.add(thread);
        thread.start();
        return thread;
    }

    private void publish(DomainEvent event) {
        broker.append(event.eventType(), codec.encode(event));
    }

    private static EventHandler acking(List<DomainEvent> seen) {
        return (event, message) -> {
            seen.add(event);
            message.ack();
        };
    }

    private CursorProvider decorated(UnaryOperator<PullCursor> decorate) {
        return new CursorProvider() {
            @Override
            public boolean ensureDurable(ConsumerDefinition definition) {
                return broker.ensureDurable(definition);
            }

            @Override
            public PullCursor open(ConsumerDefinition definition) {
                return decorate.apply(broker.open(definition));
            }
        };
    }

    private static class ForwardingCursor implements PullCursor {
        private final PullCursor delegate;

        ForwardingCursor(PullCursor delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<DeliveredMessage> fetch(int batchSize, Duration timeout) throws Exception {
            return delegate.fetch(batchSize, timeout);
        }

        @Override
        public boolean isActive() {
            return delegate.isActive();
        }

        @Override
        public void unsubscribe() throws Exception {
            delegate.unsubscribe();
        }
    }

    private double counter(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void dispatchesInDeliveryOrderAndLeavesAckingToTheHandler() {
        List<DomainEvent> published = List.of(TestEvents.course("A"), TestEvents.exam("E1"), TestEvents.quiz("Q1"));
        published.forEach(this::publish);
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(definition());

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 3, "three events handled");
        assertThat(seen).containsExactlyElementsOf(published);
        assertThat(broker.acked(DURABLE)).containsExactly(1L, 2L, 3L);
        assertThat(broker.naked(DURABLE)).isEmpty();
        assertThat(counter("nats.events.consumed", "event_type", CourseCreatedEvent.TYPE, "status", "ack")).isEqualTo(1.0);
        assertThat(registry.find("nats.consumer.lag").tag("consumer", DURABLE).gauge().value()).isZero();
    }

    @Test
    void handlerThatDoesNotAckLeavesTheMessageUnsettled() {
        publish(TestEvents.course("A"));
        AtomicInteger calls = new AtomicInteger();
        EventConsumer consumer = consumer(definition());

        subscribeInBackground(consumer, (event, message) -> calls.incrementAndGet(), Duration.ofSeconds(1));

        Await.until(() -> calls.get() == 1, "handler called");
        consumer.stop(Duration.ofSeconds(1));
        assertThat(broker.acked(DURABLE)).isEmpty();
        assertThat(broker.naked(DURABLE)).isEmpty();
    }

    @Test
    void walksThroughTheLifecycleStates() throws InterruptedException {
        EventConsumer consumer = consumer(definition());
        assertThat(consumer.state()).isEqualTo(ConsumerState.CREATED);
        assertThat(consumer.isRunning()).isFalse();

        Thread thread = subscribeInBackground(consumer, (e, m) -> m.ack(), Duration.ofSeconds(1));
        Await.until(() -> consumer.state() == ConsumerState.RUNNING, "consumer running");
        assertThat(consumer.isRunning()).isTrue();

        consumer.stop(Duration.ofSeconds(1));

        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
        assertThat(consumer.isRunning()).isFalse();
        thread.join(2_000);
        assertThat(thread.isAlive()).isFalse();
        assertThat(loopFailure.get()).isNull();
    }

    @Test
    void aConsumerCannotBeSubscribedTwice() {
        EventConsumer consumer = consumer(definition());
        subscribeInBackground(consumer, (e, m) -> m.ack(), Duration.ofSeconds(1));
        Await.until(() -> consumer.state() == ConsumerState.RUNNING, "consumer running");

        assertThatThrownBy(() -> consumer.subscribe((e, m) -> m.ack(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class);

        consumer.stop(Duration.ofSeconds(1));
        assertThatThrownBy(() -> consumer.subscribe((e, m) -> m.ack(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopBeforeSubscribeIsTerminal() {
        EventConsumer consumer = consumer(definition());
        consumer.stop();
        consumer.stop();

        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
        assertThatThrownBy(() -> consumer.subscribe((e, m) -> m.ack(), null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void poisonMessageIsNakedOnceWithoutReachingTheHandler() {
        ConsumerDefinition singleDelivery = new ConsumerDefinition(InMemoryBroker.STREAM, DURABLE, AckPolicy.Explicit,
                Duration.ofSeconds(30), 1, List.of("academic.>"), DeliverPolicy.All, null, null,
                ReplayPolicy.Instant, 10, FETCH_TIMEOUT, null);
        broker.append("academic.course.created", "{not json");
        publish(TestEvents.course("after-poison"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(singleDelivery);

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 1, "valid event handled");
        assertThat(seen.get(0)).isInstanceOfSatisfying(CourseCreatedEvent.class,
                e -> assertThat(e.courseId()).isEqualTo("after-poison"));
        assertThat(broker.naked(DURABLE)).containsExactly(1L);
        assertThat(broker.acked(DURABLE)).containsExactly(2L);
        assertThat(counter("nats.consumer.errors", "consumer", DURABLE, "error_type", "DecodeError")).isEqualTo(1.0);
        assertThat(counter("nats.events.consumed", "event_type", "academic.course.created", "status", "nak")).isEqualTo(1.0);
    }

    @Test
    void jsonNullPayloadIsNakedAndTheLoopKeepsGoing() {
        ConsumerDefinition singleDelivery = new ConsumerDefinition(InMemoryBroker.STREAM, DURABLE, AckPolicy.Explicit,
                Duration.ofSeconds(30), 1, List.of("academic.>"), DeliverPolicy.All, null, null,
                ReplayPolicy.Instant, 10, FETCH_TIMEOUT, null);
        broker.append("academic.course.created", "null");
        publish(TestEvents.course("after-null"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(singleDelivery);

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 1, "valid event handled");
        assertThat(loopFailure.get()).isNull();
        assertThat(consumer.state()).isEqualTo(ConsumerState.RUNNING);
        assertThat(broker.naked(DURABLE)).containsExactly(1L);
        assertThat(broker.acked(DURABLE)).containsExactly(2L);
        assertThat(counter("nats.consumer.errors", "consumer", DURABLE, "error_type", "DecodeError")).isEqualTo(1.0);
    }

    @Test
    void unexpectedMessageFailureIsNakedAndTheLoopKeepsGoing() {
        List<String> naked = Collections.synchronizedList(new ArrayList<>());
        DeliveredMessage broken = Stubs.of(DeliveredMessage.class)
                .returning("subject", "academic.course.created")
                .on("pending", args -> {
                    throw new IllegalArgumentException("Invalid JetStream metadata");
                })
                .on("nak", args -> naked.add("broken"))
                .build();
        AtomicBoolean brokenDelivered = new AtomicBoolean();
        CursorProvider provider = decorated(delegate -> new ForwardingCursor(delegate) {
            @Override
            public List<DeliveredMessage> fetch(int batchSize, Duration timeout) throws Exception {
                if (brokenDelivered.compareAndSet(false, true)) {
                    return List.of(broken);
                }
                return super.fetch(batchSize, timeout);
            }
        });
        publish(TestEvents.course("A"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = new EventConsumer(provider, codec, definition(), metrics, Duration.ofMillis(10));
        consumers.add(consumer);

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 1, "event after the broken message handled");
        assertThat(naked).containsExactly("broken");
        assertThat(loopFailure.get()).isNull();
        assertThat(counter("nats.consumer.errors", "consumer", DURABLE, "error_type", "IllegalArgumentException"))
                .isEqualTo(1.0);
        assertThat(metrics.inFlight(DURABLE).get()).isZero();
    }

    @Test
    void errorEscapingTheLoopStillReleasesTheSubscription() {
        AtomicInteger unsubscribes = new AtomicInteger();
        broker.onUnsubscribe(unsubscribes::incrementAndGet);
        publish(TestEvents.course("A"));
        EventConsumer consumer = consumer(definition());

        assertThatThrownBy(() -> consumer.subscribe((event, message) -> {
            throw new AssertionError("handler bug");
        }, Duration.ofSeconds(1)))
                .isInstanceOf(AssertionError.class)
                .hasMessage("handler bug");

        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
        assertThat(unsubscribes.get()).isEqualTo(1);
    }

    @Test
    void stopWhileBindingReleasesTheSubscriptionOnce() throws InterruptedException {
        CountDownLatch binding = new CountDownLatch(1);
        CountDownLatch bound = new CountDownLatch(1);
        AtomicInteger unsubscribes = new AtomicInteger();
        broker.onUnsubscribe(unsubscribes::incrementAndGet);
        CursorProvider slowBind = new CursorProvider() {
            @Override
            public boolean ensureDurable(ConsumerDefinition definition) {
                return broker.ensureDurable(definition);
            }

            @Override
            public PullCursor open(ConsumerDefinition definition) throws InterruptedException {
                binding.countDown();
                bound.await();
                return broker.open(definition);
            }
        };
        EventConsumer consumer = new EventConsumer(slowBind, codec, definition(), metrics, Duration.ofMillis(10));
        consumers.add(consumer);
        Thread thread = subscribeInBackground(consumer, (e, m) -> m.ack(), Duration.ofSeconds(1));
        assertThat(binding.await(5, TimeUnit.SECONDS)).isTrue();

        consumer.stop(Duration.ofSeconds(1));
        bound.countDown();
        thread.join(5_000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
        assertThat(unsubscribes.get()).isEqualTo(1);
        assertThat(loopFailure.get()).isNull();
    }

    @Test
    void handlerExceptionIsIsolatedToItsMessage() {
        ConsumerDefinition singleDelivery = new ConsumerDefinition(InMemoryBroker.STREAM, DURABLE, AckPolicy.Explicit,
                Duration.ofSeconds(30), 1, List.of(), DeliverPolicy.All, null, null,
                ReplayPolicy.Instant, 10, FETCH_TIMEOUT, null);
        publish(TestEvents.course("A"));
        publish(TestEvents.course("B"));
        List<String> handled = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(singleDelivery);

        subscribeInBackground(consumer, (event, message) -> {
            CourseCreatedEvent course = (CourseCreatedEvent) event;
            if (course.courseId().equals("A")) {
                throw new IllegalStateException("boom");
            }
            handled.add(course.courseId());
            message.ack();
        }, Duration.ofSeconds(1));

        Await.until(() -> handled.contains("B"), "B handled after A failed");
        assertThat(broker.naked(DURABLE)).containsExactly(1L);
        assertThat(broker.acked(DURABLE)).containsExactly(2L);
        assertThat(counter("nats.consumer.errors", "consumer", DURABLE, "error_type", "IllegalStateException"))
                .isEqualTo(1.0);
        assertThat(counter("nats.events.consumed", "event_type", CourseCreatedEvent.TYPE, "status", "error"))
                .isEqualTo(1.0);
        assertThat(consumer.state()).isEqualTo(ConsumerState.RUNNING);
    }

    @Test
    void nakedMessagesAreRedeliveredUpToMaxDeliver() {
        publish(TestEvents.course("A"));
        AtomicInteger attempts = new AtomicInteger();
        List<Long> deliveryCounts = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(definition());

        subscribeInBackground(consumer, (event, message) -> {
            attempts.incrementAndGet();
            deliveryCounts.add(message.deliveryCount());
            message.nak();
        }, Duration.ofSeconds(1));

        Await.until(() -> attempts.get() == 3, "three deliveries");
        assertThat(deliveryCounts).containsExactly(1L, 2L, 3L);
    }

    @Test
    void inFlightGaugeIsBalancedAcrossEveryOutcome() {
        broker.append("academic.course.created", "garbage");
        publish(TestEvents.course("ok"));
        publish(TestEvents.course("fail"));
        AtomicInteger observedInFlight = new AtomicInteger(-1);
        AtomicInteger calls = new AtomicInteger();
        EventConsumer consumer = consumer(definition());

        subscribeInBackground(consumer, (event, message) -> {
            observedInFlight.set(metrics.inFlight(DURABLE).get());
            calls.incrementAndGet();
            if (((CourseCreatedEvent) event).courseId().equals("fail")) {
                throw new IOException("downstream");
            }
            message.ack();
        }, Duration.ofSeconds(1));

        Await.until(() -> calls.get() >= 2, "both decodable events handled");
        consumer.stop(Duration.ofSeconds(1));

        assertThat(observedInFlight).hasValue(1);
        assertThat(registry.find("nats.consumer.processing").tag("consumer", DURABLE).gauge().value()).isZero();
    }

    @Test
    void newInstanceWithTheSameDurableResumesAfterAckedMessages() {
        publish(TestEvents.course("M"));
        List<DomainEvent> first = Collections.synchronizedList(new ArrayList<>());
        EventConsumer firstConsumer = consumer(definition());
        subscribeInBackground(firstConsumer, acking(first), Duration.ofSeconds(1));
        Await.until(() -> first.size() == 1, "first consumer handled M");
        firstConsumer.stop(Duration.ofSeconds(1));

        publish(TestEvents.course("N"));
        List<DomainEvent> second = Collections.synchronizedList(new ArrayList<>());
        EventConsumer secondConsumer = consumer(definition());
        subscribeInBackground(secondConsumer, acking(second), Duration.ofSeconds(1));

        Await.until(() -> second.size() == 1, "second consumer handled N");
        assertThat(((CourseCreatedEvent) second.get(0)).courseId()).isEqualTo("N");
        assertThat(broker.acked(DURABLE)).containsExactly(1L, 2L);
    }

    @Test
    void stopCompletesWithinGraceWhenUnsubscribeHangs() {
        CountDownLatch never = new CountDownLatch(1);
        broker.onUnsubscribe(never::await);
        EventConsumer consumer = consumer(definition());
        subscribeInBackground(consumer, (e, m) -> m.ack(), Duration.ofMillis(200));
        Await.until(() -> consumer.state() == ConsumerState.RUNNING, "consumer running");

        long started = System.nanoTime();
        consumer.stop(Duration.ofMillis(200));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
        assertThat(elapsedMs).isLessThan(2_000);
        never.countDown();
    }

    @Test
    void stopSwallowsUnsubscribeFailures() {
        broker.onUnsubscribe(() -> {
            throw new IOException("connection closed");
        });
        EventConsumer consumer = consumer(definition());
        subscribeInBackground(consumer, (e, m) -> m.ack(), Duration.ofSeconds(1));
        Await.until(() -> consumer.state() == ConsumerState.RUNNING, "consumer running");

        consumer.stop(Duration.ofSeconds(1));

        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
    }

    @Test
    void interruptingTheSubscribingThreadCancelsAndStops() throws InterruptedException {
        EventConsumer consumer = consumer(definition());
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicReference<Boolean> interruptFlag = new AtomicReference<>();
        Thread thread = new Thread(() -> {
            try {
                consumer.subscribe((e, m) -> m.ack(), Duration.ofSeconds(1));
            } catch (RuntimeException e) {
                thrown.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        threads.add(thread);
        thread.start();
        Await.until(() -> consumer.state() == ConsumerState.RUNNING, "consumer running");

        thread.interrupt();
        thread.join(5_000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(thrown.get()).isInstanceOf(ConsumerCancelledException.class);
        assertThat(interruptFlag.get()).isTrue();
        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
    }

    @Test
    void subscribeFailureIsWrappedAndTerminal() {
        CursorProvider failing = new CursorProvider() {
            @Override
            public boolean ensureDurable(ConsumerDefinition definition) throws IOException {
                throw new IOException("stream not found");
            }

            @Override
            public PullCursor open(ConsumerDefinition definition) {
                throw new AssertionError("open must not be called");
            }
        };
        EventConsumer consumer = new EventConsumer(failing, codec, definition(), metrics);

        assertThatThrownBy(() -> consumer.subscribe((e, m) -> m.ack(), null))
                .isInstanceOf(ConsumerException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining(DURABLE);
        assertThat(consumer.state()).isEqualTo(ConsumerState.STOPPED);
    }

    @Test
    void clientVerifiedFilteringTerminatesStrayMessages() {
        broker.ignoreMultipleFilters();
        ConsumerDefinition def = definition(DURABLE, List.of("academic.course.*", "academic.exam.*"))
                .withMultiFilterStrategy(MultiFilterStrategy.CLIENT_VERIFIED);
        publish(TestEvents.course("A"));
        publish(TestEvents.quiz("Q"));
        publish(TestEvents.exam("E"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(def);

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 2, "course and exam handled");
        assertThat(seen).extracting(DomainEvent::eventType)
                .containsExactly("academic.course.created", "academic.exam.created");
        assertThat(broker.terminated(DURABLE)).containsExactly(2L);
        assertThat(counter("nats.consumer.errors", "consumer", DURABLE, "error_type", "FilterMismatch")).isEqualTo(1.0);
    }

    @Test
    void serverSideFilteringPassesEverythingDelivered() {
        broker.ignoreMultipleFilters();
        ConsumerDefinition def = definition(DURABLE, List.of("academic.course.*", "academic.exam.*"));
        publish(TestEvents.course("A"));
        publish(TestEvents.quiz("Q"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(def);

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 2, "both delivered events handled");
        assertThat(broker.terminated(DURABLE)).isEmpty();
    }

    @Test
    void fetchFailuresAreRecordedAndTheLoopKeepsGoing() {
        AtomicInteger fetches = new AtomicInteger();
        CursorProvider flaky = new CursorProvider() {
            @Override
            public boolean ensureDurable(ConsumerDefinition definition) {
                return broker.ensureDurable(definition);
            }

            @Override
            public PullCursor open(ConsumerDefinition definition) {
                PullCursor delegate = broker.open(definition);
                return new PullCursor() {
                    @Override
                    public List<DeliveredMessage> fetch(int batchSize, Duration timeout) throws Exception {
                        if (fetches.incrementAndGet() <= 2) {
                            throw new IOException("timeout waiting for pull response");
                        }
                        return delegate.fetch(batchSize, timeout);
                    }

                    @Override
                    public boolean isActive() {
                        return delegate.isActive();
                    }

                    @Override
                    public void unsubscribe() throws Exception {
                        delegate.unsubscribe();
                    }
                };
            }
        };
        publish(TestEvents.course("A"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = new EventConsumer(flaky, codec, definition(), metrics, Duration.ofMillis(10));
        consumers.add(consumer);

        subscribeInBackground(consumer, acking(seen), Duration.ofSeconds(1));

        Await.until(() -> seen.size() == 1, "event handled after fetch failures");
        assertThat(counter("nats.consumer.errors", "consumer", DURABLE, "error_type", "IOException")).isEqualTo(2.0);
    }

    @Test
    void startRunsInTheBackgroundAndDisposeStops() {
        publish(TestEvents.course("A"));
        List<DomainEvent> seen = Collections.synchronizedList(new ArrayList<>());
        EventConsumer consumer = consumer(definition());

        Disposable running = consumer.start(acking(seen), Duration.ofSeconds(1));
        Await.until(() -> seen.size() == 1, "event handled");

        running.dispose();

        Await.until(() -> consumer.state() == ConsumerState.STOPPED, "consumer stopped");
    }

    @Test
    void factoryResolvesNamedDefinitions() {
        EventConsumerFactory factory = new EventConsumerFactory(broker, codec, metrics,
                key -> definition(key.replace('.', '-'), List.of()));

        EventConsumer consumer = factory.create("course.sync");

        assertThat(consumer.definition().durableName()).isEqualTo("course-sync");
        assertThat(consumer.state()).isEqualTo(ConsumerState.CREATED);
        assertThatThrownBy(() -> new EventConsumerFactory(broker, codec, metrics).create("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }
}
