package com.vertector.nats.connection;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;

import java.io.IOException;

/** Opens the transport; {@link #nats()} is the production implementation. */
@FunctionalInterface
public interface ConnectionFactory {

    Connection connect(Options options) throws IOException, InterruptedException;

    static ConnectionFactory nats() {
        return Nats::connect;
    }
}
