package com.vertector.nats.connection;

import com.vertector.nats.config.ConnectionSettings;
import com.vertector.nats.jetstream.StreamProvisioner;
import com.vertector.nats.metrics.EventMetrics;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ErrorListener;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamOptions;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single NATS connection of the process and its JetStream contexts.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Open the connection from {@link ConnectionSettings} with typed jnats
 *       {@link Options}, optional TLS and optional authentication.</li>
 *   <li>Create the {@link JetStream} and {@link JetStreamManagement} contexts and
 *       provision the configured streams.</li>
 *   <li>Translate client lifecycle callbacks into {@link ConnectionState} for
 *       registered listeners and metrics, and track them in {@link #isConnected()}.
 *       Once the client reports the connection closed, {@link #connect()} opens a new one.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link #connect()} and {@link #close()} are serialized by a lock and are idempotent.
 * {@link #isConnected()} is a plain volatile read.
 *
 * <p><b>Security note</b>: tokens and passwords are never logged; usernames are masked.</p>
 */
public class NatsConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NatsConnectionManager.class);

    private final ConnectionSettings settings;
    private final EventMetrics metrics;
    private final ConnectionFactory factory;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean connected;
    private volatile Connection connection;
    private volatile JetStream jetStream;
    private volatile JetStreamManagement jetStreamManagement;

    public NatsConnectionManager(ConnectionSettings settings, EventMetrics metrics) {
        this(settings, metrics, ConnectionFactory.nats());
    }

    public NatsConnectionManager(ConnectionSettings settings, EventMetrics metrics, ConnectionFactory factory) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public ConnectionSettings settings() {
        return settings;
    }

    /**
     * Opens the connection, creates the JetStream contexts and provisions streams.
     * Calling it again while connected only logs a warning.
     *
     * @throws NatsConnectionException if the transport or the JetStream contexts cannot
     *                                 be created
     */
    public void connect() {
        lock.lock();
        try {
            if (connection != null) {
                log.warn("NATS connection already open (name={}, connected={}); ignoring connect()",
                        settings.connectionName(), connected);
                return;
            }

            Options options = buildOptions();
            Connection conn;
            try {
                conn = factory.connect(options);
            } catch (IOException e) {
                throw new NatsConnectionException("Failed to connect to NATS servers=" + settings.servers(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NatsConnectionException("Interrupted while connecting to NATS servers=" + settings.servers(), e);
            }

            log.info("Connected to NATS (servers={}, name={}, tls={}, auth={}, user={})",
                    settings.servers(),
                    settings.connectionName(),
                    settings.tls().enabled(),
                    settings.auth().enabled(),
                    settings.auth().username() == null ? "" : mask(settings.auth().username()));

            if (settings.jetStreamEnabled()) {
                try {
                    JetStreamOptions jso = jetStreamOptions();
                    jetStream = conn.jetStream(jso);
                    jetStreamManagement = conn.jetStreamManagement(jso);
                } catch (IOException e) {
                    closeQuietly(conn);
                    throw new NatsConnectionException("Failed to create JetStream contexts", e);
                }
                log.info("JetStream enabled (domain={}, streams={})",
                        settings.jetStreamDomain() == null ? "" : settings.jetStreamDomain(),
                        settings.streams().size());
                new StreamProvisioner(jetStreamManagement, metrics).provision(settings.streams());
            }

            connection = conn;
            connected = true;
            metrics.recordConnectionStatus(settings.connectionName(), true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drains in-flight work within {@link ConnectionSettings#drainTimeout()} and closes
     * the connection. Safe to call when not connected.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            Connection conn = connection;
            connection = null;
            jetStream = null;
            jetStreamManagement = null;
            connected = false;
            if (conn == null) {
                return;
            }

            Duration drain = settings.drainTimeout();
            try {
                conn.drain(drain).get(drain.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("NATS drain did not complete within {} ms; closing", drain.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining NATS connection; closing");
            } catch (ExecutionException | RuntimeException e) {
                log.warn("NATS drain failed; closing: {}", e.toString());
            }
            closeQuietly(conn);
            metrics.recordConnectionStatus(settings.connectionName(), false);
            log.info("NATS connection closed (name={})", settings.connectionName());
        } finally {
            lock.unlock();
        }
    }

    public boolean isConnected() {
        return connected;
    }

    /** @throws IllegalStateException if not connected */
    public Connection connection() {
        Connection conn = connection;
        if (conn == null) {
            throw new IllegalStateException("NATS connection is not established; call connect() first");
        }
        return conn;
    }

    /** @throws IllegalStateException if not connected or JetStream is disabled */
    public JetStream jetStream() {
        JetStream js = jetStream;
        if (js == null) {
            throw new IllegalStateException("JetStream is not available; connect() first with JetStream enabled");
        }
        return js;
    }

    /** @throws IllegalStateException if not connected or JetStream is disabled */
    public JetStreamManagement jetStreamManagement() {
        JetStreamManagement jsm = jetStreamManagement;
        if (jsm == null) {
            throw new IllegalStateException("JetStream management is not available; connect() first with JetStream enabled");
        }
        return jsm;
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    Options buildOptions() {
        Options.Builder builder = new Options.Builder()
                .servers(settings.servers().toArray(new String[0]))
                .connectionName(settings.connectionName())
                .maxReconnects(settings.maxReconnectAttempts())
                .reconnectWait(settings.reconnectWait())
                .connectionTimeout(settings.connectTimeout())
                .maxMessagesInOutgoingQueue(settings.maxPendingMessages())
                .connectionListener(connectionListener())
                .errorListener(errorListener());

        ConnectionSettings.Tls tls = settings.tls();
        if (tls.enabled()) {
            try {
                builder.sslContext(TlsContextFactory.create(tls));
            } catch (RuntimeException e) {
                throw new NatsConnectionException("Failed to load TLS material (ca=" + tls.caFile()
                        + ", cert=" + tls.certFile() + ")", e);
            }
        }

        ConnectionSettings.Auth auth = settings.auth();
        if (auth.usesToken()) {
            builder.token(auth.token().toCharArray());
        } else if (auth.usesUserPassword()) {
            String password = auth.password() == null ? "" : auth.password();
            builder.userInfo(auth.username(), password);
        }
        return builder.build();
    }

    private JetStreamOptions jetStreamOptions() {
        JetStreamOptions.Builder builder = JetStreamOptions.builder()
                .requestTimeout(settings.requestTimeout());
        if (settings.jetStreamDomain() != null) {
            builder.domain(settings.jetStreamDomain());
        }
        return builder.build();
    }

    private ConnectionListener connectionListener() {
        return (conn, type) -> {
            ConnectionState state = switch (type) {
                case CONNECTED -> ConnectionState.CONNECTED;
                case DISCONNECTED -> ConnectionState.DISCONNECTED;
                case RECONNECTED -> ConnectionState.RECONNECTED;
                case CLOSED -> ConnectionState.CLOSED;
                default -> null;
            };
            if (state == null) {
                log.debug("NATS connection event {} (name={})", type, settings.connectionName());
                return;
            }
            onStateChange(conn, state);
        };
    }

    private ErrorListener errorListener() {
        return new ErrorListener() {
            @Override
            public void errorOccurred(Connection conn, String error) {
                log.error("NATS error (name={}): {}", settings.connectionName(), error);
            }

            @Override
            public void exceptionOccurred(Connection conn, Exception exp) {
                log.error("NATS exception (name={}): {}", settings.connectionName(), exp.toString(), exp);
            }
        };
    }

    /**
     * Applies a lifecycle event of {@code source} to the connected flag and fans it out.
     * Events of a connection other than the current one are only logged and passed to
     * listeners. Runs on
     * the client's callback executor, which {@code Connection.close()} waits for while
     * {@link #close()} holds the lock, so the fields are updated without it.
     */
    void onStateChange(Connection source, ConnectionState state) {
        String client = settings.connectionName();
        Connection current = connection;
        boolean ofCurrent = current != null && (source == null || source == current);
        if (ofCurrent) {
            switch (state) {
                case CONNECTED, RECONNECTED -> connected = true;
                case DISCONNECTED -> connected = false;
                case CLOSED -> {
                    connected = false;
                    jetStream = null;
                    jetStreamManagement = null;
                    connection = null;
                }
            }
        }
        switch (state) {
            case CONNECTED -> log.info("NATS connected (name={})", client);
            case RECONNECTED -> {
                log.info("NATS reconnected (name={})", client);
                metrics.recordReconnect(client);
            }
            case DISCONNECTED -> log.warn("NATS disconnected (name={})", client);
            case CLOSED -> log.info("NATS connection closed by client (name={})", client);
        }
        if (ofCurrent) {
            metrics.recordConnectionStatus(client, connected);
        }

        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChange(state);
            } catch (RuntimeException e) {
                log.warn("Connection state listener failed (state={}): {}", state, e.toString());
            }
        }
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing NATS connection");
        } catch (RuntimeException e) {
            log.warn("Closing NATS connection failed: {}", e.toString());
        }
    }

    /**
     * Masks a string for logging purposes.
     *
     * <p>Keeps the first and last character and replaces the middle with {@code ***}.</p>
     */
    private static String mask(String s) {
        if (s.length() <= 2) {
            return "**";
        }
        return s.charAt(0) + "***" + s.charAt(s.length() - 1);
    }
}
