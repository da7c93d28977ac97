package com.vertector.nats.consumer;

/** The consumer could not be set up, for example the durable cursor could not be created or bound. */
public class ConsumerException extends RuntimeException {

    public ConsumerException(String message, Throwable cause) {
        super(message, cause);
    }
}
