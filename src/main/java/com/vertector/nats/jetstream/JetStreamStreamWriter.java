package com.vertector.nats.jetstream;

import com.vertector.nats.publisher.OutboundMessage;
import com.vertector.nats.publisher.PubAck;
import com.vertector.nats.publisher.StreamWriter;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link StreamWriter} over a JetStream context.
 *
 * <p>The message id is passed as {@link PublishOptions#getMessageId()} so the stream
 * drops re-sent copies of the same event within its duplicate window. The JetStream
 * context is looked up on every write so the writer can be created before the
 * connection is up.</p>
 */
public class JetStreamStreamWriter implements StreamWriter {

    private final Supplier<JetStream> jetStream;

    public JetStreamStreamWriter(Supplier<JetStream> jetStream) {
        this.jetStream = Objects.requireNonNull(jetStream, "jetStream");
    }

    @Override
    public PubAck write(OutboundMessage message, Duration timeout) throws IOException, JetStreamApiException {
        Headers headers = new Headers();
        message.headers().forEach((name, value) -> headers.put(name, value));

        PublishOptions options = PublishOptions.builder()
                .messageId(message.messageId())
                .streamTimeout(timeout)
                .build();

        PublishAck ack = jetStream.get().publish(message.subject(), headers, message.payload(), options);
        return new PubAck(ack.getStream(), ack.getSeqno(), ack.isDuplicate());
    }
}
