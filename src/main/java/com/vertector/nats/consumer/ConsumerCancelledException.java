package com.vertector.nats.consumer;

import java.util.concurrent.CancellationException;

/**
 * Thrown out of {@link EventConsumer#subscribe} after the calling thread was interrupted
 * and the consumer has shut down. The thread's interrupt flag is set again before it is
 * thrown.
 */
public class ConsumerCancelledException extends CancellationException {

    public ConsumerCancelledException(String message) {
        super(message);
    }
}
