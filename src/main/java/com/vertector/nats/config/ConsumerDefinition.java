package com.vertector.nats.config;

import io.nats.client.api.AckPolicy;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a durable pull cursor and of how an
 * {@link com.vertector.nats.consumer.EventConsumer} drives it.
 *
 * <p><b>Durable identity</b>: the durable name is the identity of the cursor. A new
 * consumer instance created with the same name resumes from the last acknowledged
 * position instead of applying {@link #deliverPolicy()} again.</p>
 *
 * @param stream              stream the cursor reads from
 * @param durableName         durable cursor name
 * @param ackPolicy           acknowledgment policy
 * @param ackWait             time before an unacked message is redelivered, at least one second
 * @param maxDeliver          delivery attempts per message, {@code -1} for unlimited
 * @param filterSubjects      subject filters, possibly empty
 * @param deliverPolicy       start position for a newly created cursor
 * @param startSequence       start sequence, required for {@link DeliverPolicy#ByStartSequence}
 * @param startTime           start time, required for {@link DeliverPolicy#ByStartTime}
 * @param replayPolicy        replay speed
 * @param batchSize           messages requested per fetch
 * @param fetchTimeout        bound on one fetch
 * @param multiFilterStrategy handling of more than one filter subject
 */
public record ConsumerDefinition(
        String stream,
        String durableName,
        AckPolicy ackPolicy,
        Duration ackWait,
        long maxDeliver,
        List<String> filterSubjects,
        DeliverPolicy deliverPolicy,
        Long startSequence,
        Instant startTime,
        ReplayPolicy replayPolicy,
        int batchSize,
        Duration fetchTimeout,
        MultiFilterStrategy multiFilterStrategy
) {

    public static final Duration DEFAULT_ACK_WAIT = Duration.ofSeconds(30);
    public static final long DEFAULT_MAX_DELIVER = 3;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(5);

    public ConsumerDefinition {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream is required");
        }
        if (durableName == null || durableName.isBlank()) {
            throw new IllegalArgumentException("durableName is required");
        }
        if (durableName.contains(".") || durableName.contains("*") || durableName.contains(">")) {
            throw new IllegalArgumentException("durableName must not contain '.', '*' or '>': " + durableName);
        }
        Objects.requireNonNull(ackWait, "ackWait is required");
        if (ackWait.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("ackWait must be at least 1s, was " + ackWait);
        }
        if (maxDeliver < -1) {
            throw new IllegalArgumentException("maxDeliver must be >= -1, was " + maxDeliver);
        }
        filterSubjects = filterSubjects == null ? List.of() : List.copyOf(filterSubjects);
        ackPolicy = ackPolicy == null ? AckPolicy.Explicit : ackPolicy;
        deliverPolicy = deliverPolicy == null ? DeliverPolicy.All : deliverPolicy;
        replayPolicy = replayPolicy == null ? ReplayPolicy.Instant : replayPolicy;
        if (deliverPolicy == DeliverPolicy.ByStartSequence && (startSequence == null || startSequence < 1)) {
            throw new IllegalArgumentException("deliverPolicy by_start_sequence requires startSequence >= 1");
        }
        if (deliverPolicy == DeliverPolicy.ByStartTime && startTime == null) {
            throw new IllegalArgumentException("deliverPolicy by_start_time requires startTime");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        Objects.requireNonNull(fetchTimeout, "fetchTimeout is required");
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive, was " + fetchTimeout);
        }
        multiFilterStrategy = multiFilterStrategy == null ? MultiFilterStrategy.SERVER_SIDE : multiFilterStrategy;
    }

    /**
     * Explicit-ack cursor delivering everything from the start, 30 s ack wait,
     * 3 deliveries, batches of 10 with a 5 s fetch timeout.
     */
    public static ConsumerDefinition of(String stream, String durableName, List<String> filterSubjects) {
        return new ConsumerDefinition(stream, durableName, AckPolicy.Explicit, DEFAULT_ACK_WAIT,
                DEFAULT_MAX_DELIVER, filterSubjects, DeliverPolicy.All, null, null, ReplayPolicy.Instant,
                DEFAULT_BATCH_SIZE, DEFAULT_FETCH_TIMEOUT, MultiFilterStrategy.SERVER_SIDE);
    }

    public ConsumerDefinition withBatch(int newBatchSize, Duration newFetchTimeout) {
        return new ConsumerDefinition(stream, durableName, ackPolicy, ackWait, maxDeliver, filterSubjects,
                deliverPolicy, startSequence, startTime, replayPolicy, newBatchSize, newFetchTimeout,
                multiFilterStrategy);
    }

    public ConsumerDefinition withMultiFilterStrategy(MultiFilterStrategy strategy) {
        return new ConsumerDefinition(stream, durableName, ackPolicy, ackWait, maxDeliver, filterSubjects,
                deliverPolicy, startSequence, startTime, replayPolicy, batchSize, fetchTimeout, strategy);
    }

    /**
     * Subject passed to the pull subscription: the single filter when exactly one is
     * configured, otherwise {@code null} so the server-side configuration decides.
     */
    public String subscriptionSubject() {
        return filterSubjects.size() == 1 ? filterSubjects.get(0) : null;
    }
}
