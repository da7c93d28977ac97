package com.vertector.nats.consumer;

import com.vertector.nats.event.DomainEvent;

/**
 * Application callback for consumed events.
 *
 * <p>The handler acknowledges through {@code message.ack()} once the event is processed.
 * Throwing makes the consumer {@code nak} the message so it is redelivered, up to the
 * cursor's max deliver.</p>
 */
@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event, DeliveredMessage message) throws Exception;
}
