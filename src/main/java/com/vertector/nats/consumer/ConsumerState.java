package com.vertector.nats.consumer;

/** Lifecycle of an {@link EventConsumer}. Transitions only move forward. */
public enum ConsumerState {
    CREATED,
    SUBSCRIBING,
    RUNNING,
    STOPPING,
    STOPPED
}
