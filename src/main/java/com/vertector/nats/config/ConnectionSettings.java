package com.vertector.nats.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable connection settings handed to
 * {@link com.vertector.nats.connection.NatsConnectionManager} at construction time.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Carries everything needed to open the transport (servers, name, reconnect tuning).</li>
 *   <li>Carries the optional security layers ({@link Auth}, {@link Tls}).</li>
 *   <li>Carries the JetStream toggle, domain and the stream definitions to provision.</li>
 * </ul>
 *
 * <h2>Construction</h2>
 * Built once at process start, usually by
 * {@link NatsProperties#toConnectionSettings()}. Library internals never look up
 * configuration from the environment; they only read this record.
 *
 * @param servers              server URLs, at least one
 * @param connectionName       client name reported to the server
 * @param maxReconnectAttempts reconnect ceiling, {@code -1} means unlimited
 * @param reconnectWait        wait between reconnect attempts
 * @param connectTimeout       bound on establishing a single connection attempt
 * @param drainTimeout         bound on draining in-flight work during close
 * @param maxPendingMessages   ceiling on messages buffered in the outgoing queue
 * @param auth                 authentication layer, never {@code null}
 * @param tls                  TLS layer, never {@code null}
 * @param jetStreamEnabled     whether to bring up JetStream and provision streams
 * @param jetStreamDomain      optional JetStream domain
 * @param requestTimeout       bound on JetStream API requests
 * @param streams              streams created or updated on connect
 */
public record ConnectionSettings(
        List<String> servers,
        String connectionName,
        int maxReconnectAttempts,
        Duration reconnectWait,
        Duration connectTimeout,
        Duration drainTimeout,
        int maxPendingMessages,
        Auth auth,
        Tls tls,
        boolean jetStreamEnabled,
        String jetStreamDomain,
        Duration requestTimeout,
        List<StreamDefinition> streams
) {

    public static final String DEFAULT_SERVER = "nats://localhost:4222";
    public static final String DEFAULT_CONNECTION_NAME = "vertector-nats-client";

    public ConnectionSettings {
        if (servers == null || servers.isEmpty()) {
            throw new IllegalArgumentException("at least one server URL is required");
        }
        for (String server : servers) {
            if (server == null || server.isBlank()) {
                throw new IllegalArgumentException("server URLs must not be blank");
            }
        }
        servers = List.copyOf(servers);
        if (connectionName == null || connectionName.isBlank()) {
            throw new IllegalArgumentException("connectionName is required");
        }
        if (maxReconnectAttempts < -1) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= -1, was " + maxReconnectAttempts);
        }
        requirePositive(reconnectWait, "reconnectWait", true);
        requirePositive(connectTimeout, "connectTimeout", false);
        requirePositive(drainTimeout, "drainTimeout", false);
        requirePositive(requestTimeout, "requestTimeout", false);
        if (maxPendingMessages < 1) {
            throw new IllegalArgumentException("maxPendingMessages must be >= 1, was " + maxPendingMessages);
        }
        auth = auth == null ? Auth.disabled() : auth;
        tls = tls == null ? Tls.disabled() : tls;
        jetStreamDomain = jetStreamDomain == null || jetStreamDomain.isBlank() ? null : jetStreamDomain;
        streams = streams == null ? List.of() : List.copyOf(streams);
    }

    /**
     * Settings for a single local server with the library defaults: 10 reconnect
     * attempts two seconds apart, 5 s timeouts, 65536 pending messages, JetStream on,
     * no streams.
     */
    public static ConnectionSettings defaults() {
        return new ConnectionSettings(
                List.of(DEFAULT_SERVER),
                DEFAULT_CONNECTION_NAME,
                10,
                Duration.ofSeconds(2),
                Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                65_536,
                Auth.disabled(),
                Tls.disabled(),
                true,
                null,
                Duration.ofSeconds(5),
                List.of()
        );
    }

    /** Copy of these settings with a different stream list. */
    public ConnectionSettings withStreams(List<StreamDefinition> newStreams) {
        return new ConnectionSettings(servers, connectionName, maxReconnectAttempts, reconnectWait,
                connectTimeout, drainTimeout, maxPendingMessages, auth, tls, jetStreamEnabled,
                jetStreamDomain, requestTimeout, newStreams);
    }

    private static void requirePositive(Duration value, String field, boolean zeroAllowed) {
        Objects.requireNonNull(value, field + " is required");
        if (value.isNegative() || (!zeroAllowed && value.isZero())) {
            throw new IllegalArgumentException(field + " must be positive, was " + value);
        }
    }

    /**
     * Authentication layer. When enabled, a token takes precedence over
     * username/password.
     */
    public record Auth(boolean enabled, String token, String username, String password) {

        public Auth {
            if (enabled && isBlank(token) && isBlank(username)) {
                throw new IllegalArgumentException("auth is enabled but neither token nor username is set");
            }
        }

        public static Auth disabled() {
            return new Auth(false, null, null, null);
        }

        public static Auth token(String token) {
            return new Auth(true, token, null, null);
        }

        public static Auth userPassword(String username, String password) {
            return new Auth(true, null, username, password);
        }

        public boolean usesToken() {
            return enabled && !isBlank(token);
        }

        public boolean usesUserPassword() {
            return enabled && !usesToken() && !isBlank(username);
        }

        @Override
        public String toString() {
            // never print secrets
            return "Auth[enabled=" + enabled + ", token=" + (isBlank(token) ? "" : "****")
                    + ", username=" + (username == null ? "" : username) + "]";
        }
    }

    /**
     * TLS layer built from PEM files. The CA certificate verifies the server; the
     * optional client certificate and PKCS#8 key enable mutual TLS.
     */
    public record Tls(boolean enabled, Path caFile, Path certFile, Path keyFile) {

        public Tls {
            if (enabled && caFile == null && certFile == null) {
                throw new IllegalArgumentException("tls is enabled but no CA or client certificate is set");
            }
            if ((certFile == null) != (keyFile == null)) {
                throw new IllegalArgumentException("tls certFile and keyFile must be set together");
            }
        }

        public static Tls disabled() {
            return new Tls(false, null, null, null);
        }

        public boolean mutual() {
            return enabled && certFile != null;
        }
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
