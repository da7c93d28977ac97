package com.vertector.nats.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot binding for every setting of the library.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Externalizes connection, security, stream, publisher and consumer settings.</li>
 *   <li>Provides defaults so an application can start with zero configuration against a
 *       local server.</li>
 *   <li>Translates the mutable JavaBean tree into the immutable records the library
 *       core consumes ({@link #toConnectionSettings()}, {@link #toPublisherSettings()},
 *       {@link #toConsumerDefinition(String)}). Nothing below the {@code config} package
 *       reads these beans.</li>
 * </ul>
 *
 * <h2>Binding</h2>
 * <pre>
 * vertector:
 *   nats:
 *     servers: [nats://localhost:4222]
 *     client-name: schedule-service
 *     auth:
 *       enabled: true
 *       token: ${NATS_TOKEN}
 *     streams:
 *       academic:
 *         max-age: 7d
 *     consumers:
 *       schedule:
 *         stream: ACADEMIC_EVENTS
 *         durable-name: schedule-service
 *         filter-subjects: [academic.schedule.*]
 * </pre>
 *
 * <p>Secrets (password, token) should come from the environment or a secrets manager,
 * never from committed files.</p>
 */
@Validated
@ConfigurationProperties(prefix = "vertector.nats")
public class NatsProperties {

    // ---------------------------------------------------------------------
    // Connectivity
    // ---------------------------------------------------------------------

    /** Server URLs. */
    @NotEmpty
    private List<String> servers = new ArrayList<>(List.of(ConnectionSettings.DEFAULT_SERVER));

    /** Client name reported to the server and used to tag connection metrics. */
    @NotBlank
    private String clientName = ConnectionSettings.DEFAULT_CONNECTION_NAME;

    /** Reconnect ceiling; {@code -1} reconnects forever. */
    @Min(-1)
    private int maxReconnectAttempts = 10;

    private Duration reconnectTimeWait = Duration.ofSeconds(2);

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration drainTimeout = Duration.ofSeconds(5);

    /** Bound on JetStream API requests. */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /** Ceiling on messages buffered in the outgoing queue. */
    @Min(1)
    private int maxPending = 65_536;

    /**
     * Whether the connection manager bean connects while the context starts. Turn off
     * to connect later, for example from a readiness hook.
     */
    private boolean autoConnect = true;

    @Valid
    private AuthProps auth = new AuthProps();

    @Valid
    private TlsProps tls = new TlsProps();

    @Valid
    private JetStreamProps jetstream = new JetStreamProps();

    @Valid
    private Streams streams = new Streams();

    @Valid
    private PublisherProps publisher = new PublisherProps();

    private AdminProps admin = new AdminProps();

    /** Named consumer definitions, looked up by key through the consumer factory. */
    @Valid
    private Map<String, ConsumerProps> consumers = new LinkedHashMap<>();

    // ---------------------------------------------------------------------
    // Translation into immutable settings
    // ---------------------------------------------------------------------

    public ConnectionSettings toConnectionSettings() {
        return new ConnectionSettings(
                servers,
                clientName,
                maxReconnectAttempts,
                reconnectTimeWait,
                connectTimeout,
                drainTimeout,
                maxPending,
                auth.toAuth(),
                tls.toTls(),
                jetstream.isEnabled(),
                jetstream.getDomain(),
                requestTimeout,
                streams.all().stream().map(StreamProps::toStreamDefinition).toList()
        );
    }

    public PublisherSettings toPublisherSettings() {
        return new PublisherSettings(
                publisher.getDefaultTimeout(),
                publisher.getMaxRetries(),
                publisher.getRetryBackoffBase(),
                publisher.getMaxPayloadBytes()
        );
    }

    /**
     * Builds the consumer definition registered under {@code key}.
     *
     * @throws IllegalArgumentException if no consumer is configured under that key
     */
    public ConsumerDefinition toConsumerDefinition(String key) {
        ConsumerProps c = consumers.get(key);
        if (c == null) {
            throw new IllegalArgumentException("Unknown consumer key: " + key + ". Valid keys=" + consumers.keySet());
        }
        return c.toConsumerDefinition();
    }

    // ---------------------------------------------------------------------
    // Getters / setters for Spring Boot binding
    // ---------------------------------------------------------------------

    public List<String> getServers() { return servers; }
    public void setServers(List<String> servers) { this.servers = servers; }

    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }

    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public void setMaxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; }

    public Duration getReconnectTimeWait() { return reconnectTimeWait; }
    public void setReconnectTimeWait(Duration reconnectTimeWait) { this.reconnectTimeWait = reconnectTimeWait; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getDrainTimeout() { return drainTimeout; }
    public void setDrainTimeout(Duration drainTimeout) { this.drainTimeout = drainTimeout; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public int getMaxPending() { return maxPending; }
    public void setMaxPending(int maxPending) { this.maxPending = maxPending; }

    public boolean isAutoConnect() { return autoConnect; }
    public void setAutoConnect(boolean autoConnect) { this.autoConnect = autoConnect; }

    public AuthProps getAuth() { return auth; }
    public void setAuth(AuthProps auth) { this.auth = auth; }

    public TlsProps getTls() { return tls; }
    public void setTls(TlsProps tls) { this.tls = tls; }

    public JetStreamProps getJetstream() { return jetstream; }
    public void setJetstream(JetStreamProps jetstream) { this.jetstream = jetstream; }

    public Streams getStreams() { return streams; }
    public void setStreams(Streams streams) { this.streams = streams; }

    public PublisherProps getPublisher() { return publisher; }
    public void setPublisher(PublisherProps publisher) { this.publisher = publisher; }

    public AdminProps getAdmin() { return admin; }
    public void setAdmin(AdminProps admin) { this.admin = admin; }

    public Map<String, ConsumerProps> getConsumers() { return consumers; }
    public void setConsumers(Map<String, ConsumerProps> consumers) { this.consumers = consumers; }

    // ---------------------------------------------------------------------
    // Nested property groups
    // ---------------------------------------------------------------------

    /** Token or username/password authentication; token wins when both are set. */
    public static class AuthProps {
        private boolean enabled = false;
        private String token;
        private String username;
        private String password;

        ConnectionSettings.Auth toAuth() {
            return enabled ? new ConnectionSettings.Auth(true, token, username, password)
                    : ConnectionSettings.Auth.disabled();
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    /** PEM-based TLS material. */
    public static class TlsProps {
        private boolean enabled = false;
        private Path caFile;
        private Path certFile;
        private Path keyFile;

        ConnectionSettings.Tls toTls() {
            return enabled ? new ConnectionSettings.Tls(true, caFile, certFile, keyFile)
                    : ConnectionSettings.Tls.disabled();
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Path getCaFile() { return caFile; }
        public void setCaFile(Path caFile) { this.caFile = caFile; }

        public Path getCertFile() { return certFile; }
        public void setCertFile(Path certFile) { this.certFile = certFile; }

        public Path getKeyFile() { return keyFile; }
        public void setKeyFile(Path keyFile) { this.keyFile = keyFile; }
    }

    /** Operational HTTP endpoints under {@code /admin/nats}; off unless enabled. */
    public static class AdminProps {
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class JetStreamProps {
        private boolean enabled = true;
        private String domain;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }
    }

    /**
     * The two default streams plus any extra streams an application declares.
     *
     * <p>Disabled streams are left out of {@link #all()} and are never provisioned.</p>
     */
    public static class Streams {
        @Valid
        private StreamProps academic = StreamProps.defaultsAcademic();

        @Valid
        private StreamProps notes = StreamProps.defaultsNotes();

        @Valid
        private Map<String, StreamProps> additional = new LinkedHashMap<>();

        /** Enabled streams in a stable order: academic, notes, then additional in declaration order. */
        public List<StreamProps> all() {
            List<StreamProps> out = new ArrayList<>();
            if (academic != null && academic.isEnabled()) out.add(academic);
            if (notes != null && notes.isEnabled()) out.add(notes);
            if (additional != null) {
                additional.values().stream().filter(StreamProps::isEnabled).forEach(out::add);
            }
            return out;
        }

        public StreamProps getAcademic() { return academic; }
        public void setAcademic(StreamProps academic) { this.academic = academic; }

        public StreamProps getNotes() { return notes; }
        public void setNotes(StreamProps notes) { this.notes = notes; }

        public Map<String, StreamProps> getAdditional() { return additional; }
        public void setAdditional(Map<String, StreamProps> additional) { this.additional = additional; }
    }

    /**
     * Settings for a single stream. Policies are strings to keep binding simple;
     * {@link JetStreamPolicies} maps them onto client enums.
     */
    public static class StreamProps {
        private boolean enabled = true;

        @NotBlank
        private String name;

        @NotEmpty
        private List<String> subjects = new ArrayList<>();

        private String retention = "workqueue";
        private String storage = "file";

        @NotNull
        private Duration maxAge = Duration.ofDays(7);

        @Min(-1)
        private long maxBytes = StreamDefinition.DEFAULT_MAX_BYTES;

        @Min(1)
        @Max(5)
        private int replicas = 1;

        private String discard = "old";

        /**
         * Academic events: one wildcard subject per entity, interest retention, 7 days.
         */
        public static StreamProps defaultsAcademic() {
            StreamProps s = new StreamProps();
            s.name = "ACADEMIC_EVENTS";
            s.subjects = new ArrayList<>(List.of(
                    "academic.profile.*",
                    "academic.course.*",
                    "academic.assignment.*",
                    "academic.exam.*",
                    "academic.quiz.*",
                    "academic.lab.*",
                    "academic.study.*",
                    "academic.challenge.*",
                    "academic.schedule.*"
            ));
            s.retention = "interest";
            s.maxAge = Duration.ofDays(7);
            return s;
        }

        /** Notes events: interest retention, 30 days. */
        public static StreamProps defaultsNotes() {
            StreamProps s = new StreamProps();
            s.name = "NOTES_EVENTS";
            s.subjects = new ArrayList<>(List.of("notes.*"));
            s.retention = "interest";
            s.maxAge = Duration.ofDays(30);
            return s;
        }

        StreamDefinition toStreamDefinition() {
            return new StreamDefinition(
                    name,
                    subjects,
                    JetStreamPolicies.parseRetentionPolicy(retention),
                    JetStreamPolicies.parseStorageType(storage),
                    maxAge,
                    maxBytes,
                    replicas,
                    JetStreamPolicies.parseDiscardPolicy(discard)
            );
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public String getRetention() { return retention; }
        public void setRetention(String retention) { this.retention = retention; }

        public String getStorage() { return storage; }
        public void setStorage(String storage) { this.storage = storage; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public String getDiscard() { return discard; }
        public void setDiscard(String discard) { this.discard = discard; }
    }

    public static class PublisherProps {
        private Duration defaultTimeout = Duration.ofSeconds(5);

        @Min(1)
        private int maxRetries = 3;

        @DecimalMin("1.0")
        private double retryBackoffBase = 2.0;

        @Min(PublisherSettings.MIN_PAYLOAD_BYTES)
        private int maxPayloadBytes = PublisherSettings.DEFAULT_MAX_PAYLOAD_BYTES;

        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public double getRetryBackoffBase() { return retryBackoffBase; }
        public void setRetryBackoffBase(double retryBackoffBase) { this.retryBackoffBase = retryBackoffBase; }

        public int getMaxPayloadBytes() { return maxPayloadBytes; }
        public void setMaxPayloadBytes(int maxPayloadBytes) { this.maxPayloadBytes = maxPayloadBytes; }
    }

    public static class ConsumerProps {
        @NotBlank
        private String stream;

        @NotBlank
        private String durableName;

        private String ackPolicy = "explicit";
        private Duration ackWait = ConsumerDefinition.DEFAULT_ACK_WAIT;

        @Min(-1)
        private long maxDeliver = ConsumerDefinition.DEFAULT_MAX_DELIVER;

        private List<String> filterSubjects = new ArrayList<>();
        private String deliverPolicy = "all";
        private Long startSequence;
        private Instant startTime;
        private String replayPolicy = "instant";

        @Min(1)
        private int batchSize = ConsumerDefinition.DEFAULT_BATCH_SIZE;

        private Duration fetchTimeout = ConsumerDefinition.DEFAULT_FETCH_TIMEOUT;
        private MultiFilterStrategy multiFilterStrategy = MultiFilterStrategy.SERVER_SIDE;

        ConsumerDefinition toConsumerDefinition() {
            return new ConsumerDefinition(
                    stream,
                    durableName,
                    JetStreamPolicies.parseAckPolicy(ackPolicy),
                    ackWait,
                    maxDeliver,
                    filterSubjects,
                    JetStreamPolicies.parseDeliverPolicy(deliverPolicy),
                    startSequence,
                    startTime,
                    JetStreamPolicies.parseReplayPolicy(replayPolicy),
                    batchSize,
                    fetchTimeout,
                    multiFilterStrategy
            );
        }

        public String getStream() { return stream; }
        public void setStream(String stream) { this.stream = stream; }

        public String getDurableName() { return durableName; }
        public void setDurableName(String durableName) { this.durableName = durableName; }

        public String getAckPolicy() { return ackPolicy; }
        public void setAckPolicy(String ackPolicy) { this.ackPolicy = ackPolicy; }

        public Duration getAckWait() { return ackWait; }
        public void setAckWait(Duration ackWait) { this.ackWait = ackWait; }

        public long getMaxDeliver() { return maxDeliver; }
        public void setMaxDeliver(long maxDeliver) { this.maxDeliver = maxDeliver; }

        public List<String> getFilterSubjects() { return filterSubjects; }
        public void setFilterSubjects(List<String> filterSubjects) { this.filterSubjects = filterSubjects; }

        public String getDeliverPolicy() { return deliverPolicy; }
        public void setDeliverPolicy(String deliverPolicy) { this.deliverPolicy = deliverPolicy; }

        public Long getStartSequence() { return startSequence; }
        public void setStartSequence(Long startSequence) { this.startSequence = startSequence; }

        public Instant getStartTime() { return startTime; }
        public void setStartTime(Instant startTime) { this.startTime = startTime; }

        public String getReplayPolicy() { return replayPolicy; }
        public void setReplayPolicy(String replayPolicy) { this.replayPolicy = replayPolicy; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

        public MultiFilterStrategy getMultiFilterStrategy() { return multiFilterStrategy; }
        public void setMultiFilterStrategy(MultiFilterStrategy multiFilterStrategy) { this.multiFilterStrategy = multiFilterStrategy; }
    }
}
