package com.vertector.nats.jetstream;

import com.vertector.nats.config.StreamDefinition;
import com.vertector.nats.metrics.EventMetrics;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.api.StreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Makes the configured streams exist with the configured settings.
 *
 * <h2>Per stream</h2>
 * <ul>
 *   <li>Looked up with {@code getStreamInfo}; API error 10059
 *       means absent, any other lookup failure fails only that stream.</li>
 *   <li>Present on the server: updated in place.</li>
 *   <li>Absent: created.</li>
 *   <li>Update rejected by the server (for example a retention change): logged as a
 *       warning and the stream is left as it is.</li>
 *   <li>Any other failure: logged as an error for that stream.</li>
 * </ul>
 *
 * <p>A failing stream never prevents the remaining ones from being provisioned.</p>
 */
public class StreamProvisioner {

    private static final Logger log = LoggerFactory.getLogger(StreamProvisioner.class);

    static final int STREAM_NOT_FOUND_ERR = 10059;

    /** Outcome of one stream. */
    public enum Outcome {
        CREATED,
        UPDATED,
        UPDATE_REJECTED,
        FAILED
    }

    private final JetStreamManagement jsm;
    private final EventMetrics metrics;

    public StreamProvisioner(JetStreamManagement jsm, EventMetrics metrics) {
        this.jsm = Objects.requireNonNull(jsm, "jsm");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /** @return one outcome per definition, in input order */
    public List<Outcome> provision(List<StreamDefinition> definitions) {
        List<Outcome> outcomes = new ArrayList<>(definitions.size());
        if (definitions.isEmpty()) {
            return outcomes;
        }
        for (StreamDefinition definition : definitions) {
            outcomes.add(ensureStream(definition));
        }
        log.info("JetStream provisioning complete: {}", outcomes);
        return outcomes;
    }

    private Outcome ensureStream(StreamDefinition definition) {
        boolean exists;
        try {
            jsm.getStreamInfo(definition.name());
            exists = true;
        } catch (JetStreamApiException e) {
            if (!isStreamNotFound(e)) {
                log.error("Failed to look up JetStream stream {} (code={} apiCode={}): {}",
                        definition.name(), e.getErrorCode(), e.getApiErrorCode(), e.getErrorDescription());
                return Outcome.FAILED;
            }
            exists = false;
        } catch (Exception e) {
            log.error("Failed to look up JetStream stream {}: {}", definition.name(), e.toString(), e);
            return Outcome.FAILED;
        }

        StreamConfiguration desired = toStreamConfiguration(definition);
        try {
            if (exists) {
                StreamInfo info = jsm.updateStream(desired);
                log.info("Updated JetStream stream: {} (subjects={}, retention={}, storage={}, maxAge={}, replicas={})",
                        desired.getName(), desired.getSubjects(), desired.getRetentionPolicy(),
                        desired.getStorageType(), desired.getMaxAge(), desired.getReplicas());
                recordState(definition.name(), info);
                return Outcome.UPDATED;
            }
            StreamInfo info = jsm.addStream(desired);
            log.info("Created JetStream stream: {} (subjects={}, retention={}, storage={}, maxAge={}, replicas={})",
                    desired.getName(), desired.getSubjects(), desired.getRetentionPolicy(),
                    desired.getStorageType(), desired.getMaxAge(), desired.getReplicas());
            recordState(definition.name(), info);
            return Outcome.CREATED;
        } catch (JetStreamApiException e) {
            if (exists) {
                log.warn("JetStream stream {} exists but the update was rejected (code={} apiCode={}): {}",
                        definition.name(), e.getErrorCode(), e.getApiErrorCode(), e.getErrorDescription());
                return Outcome.UPDATE_REJECTED;
            }
            log.error("Failed to create JetStream stream {}: {}", definition.name(), e.toString(), e);
            return Outcome.FAILED;
        } catch (Exception e) {
            log.error("Failed to provision JetStream stream {}: {}", definition.name(), e.toString(), e);
            return Outcome.FAILED;
        }
    }

    private static boolean isStreamNotFound(JetStreamApiException e) {
        return e.getApiErrorCode() == STREAM_NOT_FOUND_ERR;
    }

    private void recordState(String stream, StreamInfo info) {
        if (info == null) {
            return;
        }
        StreamState state = info.getStreamState();
        if (state != null) {
            metrics.recordStreamState(stream, state.getMsgCount(), state.getByteCount());
        }
    }

    static StreamConfiguration toStreamConfiguration(StreamDefinition definition) {
        return StreamConfiguration.builder()
                .name(definition.name())
                .subjects(definition.subjects())
                .retentionPolicy(definition.retention())
                .storageType(definition.storage())
                .maxAge(definition.maxAge())
                .maxBytes(definition.maxBytes())
                .replicas(definition.replicas())
                .discardPolicy(definition.discard())
                .build();
    }
}
