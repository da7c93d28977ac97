package com.vertector.nats.jetstream;

import com.vertector.nats.consumer.DeliveredMessage;
import io.nats.client.Message;
import io.nats.client.impl.Headers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@link DeliveredMessage} view of a jnats {@link Message}. */
class JetStreamDeliveredMessage implements DeliveredMessage {

    private final Message message;

    JetStreamDeliveredMessage(Message message) {
        this.message = message;
    }

    @Override
    public String subject() {
        return message.getSubject();
    }

    @Override
    public byte[] data() {
        byte[] data = message.getData();
        return data == null ? new byte[0] : data;
    }

    /** First value of each header. */
    @Override
    public Map<String, String> headers() {
        Headers headers = message.getHeaders();
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : headers.keySet()) {
            result.put(name, headers.getFirst(name));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public long deliveryCount() {
        return message.isJetStream() ? message.metaData().deliveredCount() : 1;
    }

    @Override
    public long pending() {
        return message.isJetStream() ? message.metaData().pendingCount() : -1;
    }

    @Override
    public void ack() {
        message.ack();
    }

    @Override
    public void nak() {
        message.nak();
    }

    @Override
    public void term() {
        message.term();
    }

    @Override
    public void inProgress() {
        message.inProgress();
    }
}
