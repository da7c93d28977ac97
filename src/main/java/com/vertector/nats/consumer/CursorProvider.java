package com.vertector.nats.consumer;

import com.vertector.nats.config.ConsumerDefinition;

/** Server side of an {@link EventConsumer}: durable cursor management and binding. */
public interface CursorProvider {

    /**
     * Creates the durable cursor if the stream has none with this name; an existing one
     * is reused as is.
     *
     * @return {@code true} if it was created, {@code false} if it already existed
     */
    boolean ensureDurable(ConsumerDefinition definition) throws Exception;

    /** Binds a pull subscription to the durable cursor. */
    PullCursor open(ConsumerDefinition definition) throws Exception;
}
