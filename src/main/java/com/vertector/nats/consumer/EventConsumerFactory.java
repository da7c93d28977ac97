package com.vertector.nats.consumer;

import com.vertector.nats.codec.EventCodec;
import com.vertector.nats.config.ConsumerDefinition;
import com.vertector.nats.metrics.EventMetrics;

import java.util.Objects;
import java.util.function.Function;

/**
 * Creates {@link EventConsumer}s sharing one cursor provider, codec and metrics.
 *
 * <p>Consumers are either built from an explicit {@link ConsumerDefinition} or looked
 * up by the key they are configured under.</p>
 */
public class EventConsumerFactory {

    private final CursorProvider provider;
    private final EventCodec codec;
    private final EventMetrics metrics;
    private final Function<String, ConsumerDefinition> namedDefinitions;

    public EventConsumerFactory(CursorProvider provider, EventCodec codec, EventMetrics metrics) {
        this(provider, codec, metrics, key -> {
            throw new IllegalArgumentException("No named consumer definitions configured; unknown key: " + key);
        });
    }

    public EventConsumerFactory(CursorProvider provider,
                                EventCodec codec,
                                EventMetrics metrics,
                                Function<String, ConsumerDefinition> namedDefinitions) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.namedDefinitions = Objects.requireNonNull(namedDefinitions, "namedDefinitions");
    }

    public EventConsumer create(ConsumerDefinition definition) {
        return new EventConsumer(provider, codec, definition, metrics);
    }

    /** @throws IllegalArgumentException if nothing is configured under {@code key} */
    public EventConsumer create(String key) {
        return create(namedDefinitions.apply(key));
    }
}
