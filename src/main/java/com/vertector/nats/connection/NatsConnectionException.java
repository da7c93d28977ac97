package com.vertector.nats.connection;

/** The connection could not be opened or its JetStream contexts could not be created. */
public class NatsConnectionException extends RuntimeException {

    public NatsConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
