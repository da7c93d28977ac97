package com.vertector.nats.connection;

/** Connection lifecycle transitions reported to {@link ConnectionStateListener}s. */
public enum ConnectionState {
    CONNECTED,
    DISCONNECTED,
    RECONNECTED,
    CLOSED
}
