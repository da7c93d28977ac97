package com.vertector.nats.jetstream;

import com.vertector.nats.config.ConsumerDefinition;
import com.vertector.nats.consumer.CursorProvider;
import com.vertector.nats.consumer.PullCursor;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.ConsumerConfiguration;

import java.io.IOException;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Durable pull cursors on JetStream.
 *
 * <p>An existing consumer is left untouched: only a missing one (API error
 * {@value #JS_CONSUMER_NOT_FOUND_ERR}) is created from the {@link ConsumerDefinition}.
 * Any other API error propagates.</p>
 */
public class JetStreamCursorProvider implements CursorProvider {

    /** JetStream API error code for "consumer not found". */
    static final int JS_CONSUMER_NOT_FOUND_ERR = 10014;

    private final Supplier<JetStream> jetStream;
    private final Supplier<JetStreamManagement> management;

    public JetStreamCursorProvider(Supplier<JetStream> jetStream, Supplier<JetStreamManagement> management) {
        this.jetStream = Objects.requireNonNull(jetStream, "jetStream");
        this.management = Objects.requireNonNull(management, "management");
    }

    @Override
    public boolean ensureDurable(ConsumerDefinition definition) throws IOException, JetStreamApiException {
        JetStreamManagement jsm = management.get();
        try {
            jsm.getConsumerInfo(definition.stream(), definition.durableName());
            return false;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_CONSUMER_NOT_FOUND_ERR) {
                throw e;
            }
        }
        jsm.addOrUpdateConsumer(definition.stream(), toConsumerConfiguration(definition));
        return true;
    }

    @Override
    public PullCursor open(ConsumerDefinition definition) throws IOException, JetStreamApiException {
        PullSubscribeOptions options = PullSubscribeOptions.bind(definition.stream(), definition.durableName());
        JetStreamSubscription subscription = jetStream.get().subscribe(definition.subscriptionSubject(), options);
        return new JetStreamPullCursor(subscription);
    }

    static ConsumerConfiguration toConsumerConfiguration(ConsumerDefinition definition) {
        ConsumerConfiguration.Builder builder = ConsumerConfiguration.builder()
                .durable(definition.durableName())
                .ackPolicy(definition.ackPolicy())
                .ackWait(definition.ackWait())
                .maxDeliver(definition.maxDeliver())
                .deliverPolicy(definition.deliverPolicy())
                .replayPolicy(definition.replayPolicy());

        if (!definition.filterSubjects().isEmpty()) {
            builder.filterSubjects(definition.filterSubjects());
        }
        if (definition.startSequence() != null) {
            builder.startSequence(definition.startSequence());
        }
        if (definition.startTime() != null) {
            builder.startTime(definition.startTime().atZone(ZoneOffset.UTC));
        }
        return builder.build();
    }
}
