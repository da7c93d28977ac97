package com.vertector.nats.codec;

/** An event could not be serialized to its wire form. */
public class EventEncodingException extends RuntimeException {

    public EventEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
