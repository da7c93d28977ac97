package com.vertector.nats.publisher;

import java.time.Duration;

/**
 * Broker-side write used by {@link EventPublisher}.
 *
 * <p>One call is one attempt: implementations must not retry on their own. Any
 * exception thrown is handed to the {@link PublishErrorClassifier} to decide whether
 * the publisher tries again.</p>
 */
@FunctionalInterface
public interface StreamWriter {

    /**
     * Writes the message and waits for the stream acknowledgment.
     *
     * @param message prepared message
     * @param timeout bound on the round trip
     * @return the acknowledgment
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws Exception            on any broker or transport failure
     */
    PubAck write(OutboundMessage message, Duration timeout) throws Exception;
}
