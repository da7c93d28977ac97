package com.vertector.nats.codec;

/**
 * A delivered payload could not be turned into a {@link com.vertector.nats.event.DomainEvent}:
 * malformed JSON, unknown {@code event_type}, or a violated field constraint.
 *
 * <p>Consumers treat such messages as poison and nak them without calling the handler.</p>
 */
public class EventDecodingException extends RuntimeException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
