package com.vertector.nats.publisher;

/**
 * The event cannot be published as it is. Raised before any broker write and never
 * retried.
 */
public class EventValidationException extends RuntimeException {

    public EventValidationException(String message) {
        super(message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
