package com.vertector.nats.consumer;

import java.util.Map;

/**
 * A message delivered by a durable cursor, with its acknowledgment operations.
 *
 * <p>Handlers are responsible for acknowledging: the consumer only calls {@link #nak()}
 * when decoding or the handler fails, and {@link #term()} for messages outside the
 * configured filters.</p>
 */
public interface DeliveredMessage {

    String subject();

    byte[] data();

    Map<String, String> headers();

    /** Delivery attempt, starting at 1. */
    long deliveryCount();

    /** Messages still pending for the cursor after this one, or {@code -1} when unknown. */
    long pending();

    /** Processed; do not redeliver. */
    void ack();

    /** Not processed; redeliver. */
    void nak();

    /** Never redeliver. */
    void term();

    /** Extends the ack deadline while a long handler runs. */
    void inProgress();
}
