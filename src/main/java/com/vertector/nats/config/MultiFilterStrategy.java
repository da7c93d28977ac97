package com.vertector.nats.config;

/**
 * How a consumer with more than one filter subject narrows its traffic.
 *
 * <p>With a single filter subject the subject is always passed to the pull
 * subscription and this setting has no effect.</p>
 */
public enum MultiFilterStrategy {

    /**
     * Filtering is left entirely to the server-side consumer configuration. The pull
     * subscription carries no subject of its own.
     */
    SERVER_SIDE,

    /**
     * Server-side filtering as above, plus a client-side check of every delivered
     * subject against the configured filters. Messages matching none of them are
     * terminated and never reach the handler.
     */
    CLIENT_VERIFIED
}
