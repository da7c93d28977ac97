package com.vertector.nats.connection;

/**
 * Receives connection lifecycle transitions. Called on the client's internal thread,
 * so implementations must return quickly.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChange(ConnectionState state);
}
