package com.vertector.nats.consumer;

import java.time.Duration;
import java.util.List;

/** A bound pull subscription on a durable cursor. */
public interface PullCursor {

    /**
     * Requests up to {@code batchSize} messages and waits at most {@code timeout}.
     *
     * @return the messages received, empty when none arrived in time
     */
    List<DeliveredMessage> fetch(int batchSize, Duration timeout) throws Exception;

    boolean isActive();

    /** Releases the subscription. The durable cursor itself is kept on the server. */
    void unsubscribe() throws Exception;
}
