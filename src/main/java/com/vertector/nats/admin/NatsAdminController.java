package com.vertector.nats.admin;

import com.vertector.nats.connection.NatsConnectionManager;
import io.nats.client.Connection;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.ConsumerInfo;
import io.nats.client.api.SequenceInfo;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.api.StreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Operational endpoints for the connection, streams and durable consumers.
 *
 * <p>Registered by {@link com.vertector.nats.config.NatsEventsConfiguration} only when
 * {@code vertector.nats.admin.enabled=true}. JetStream management calls block, so each
 * handler runs them on {@link Schedulers#boundedElastic()}.</p>
 */
@RestController
@RequestMapping(path = "/admin/nats", produces = MediaType.APPLICATION_JSON_VALUE)
public class NatsAdminController {

	private static final Logger log = LoggerFactory.getLogger(NatsAdminController.class);

	private final NatsConnectionManager manager;

	public NatsAdminController(NatsConnectionManager manager) {
		this.manager = manager;
	}

	@GetMapping("/health")
	public Mono<HealthResponse> health() {
		return Mono.fromCallable(() -> {
			String name = manager.settings().connectionName();
			if (!manager.isConnected()) {
				return new HealthResponse("down", name, "DISCONNECTED", null, Instant.now().toString());
			}
			Connection conn = manager.connection();
			Connection.Status status = conn.getStatus();
			String state = status == null ? "UNKNOWN" : status.name();
			String health = status == Connection.Status.CONNECTED ? "ok" : "degraded";
			return new HealthResponse(health, name, state, conn.getConnectedUrl(), Instant.now().toString());
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@GetMapping("/streams/{name}")
	public Mono<StreamInfoResponse> streamInfo(@PathVariable("name") String name) {
		return Mono.fromCallable(() -> {
			String streamName = requireNonBlank(name, "name");
			StreamInfo si = manager.jetStreamManagement().getStreamInfo(streamName);
			StreamConfiguration cfg = si.getConfiguration();
			StreamState ss = si.getStreamState();

			return new StreamInfoResponse(cfg.getName(), cfg.getSubjects() == null ? List.of() : cfg.getSubjects(),
					safeEnumName(cfg.getRetentionPolicy()), safeEnumName(cfg.getStorageType()), cfg.getMaxAge(),
					ss == null ? null : ss.getMsgCount(), ss == null ? null : ss.getByteCount(),
					ss == null ? null : ss.getFirstSequence(), ss == null ? null : ss.getLastSequence(),
					ss == null ? null : ss.getConsumerCount());
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@GetMapping("/streams/{stream}/consumers/{durable}")
	public Mono<ConsumerInfoResponse> consumerInfo(@PathVariable("stream") String stream,
			@PathVariable("durable") String durable) {
		return Mono.fromCallable(() -> {
			String streamName = requireNonBlank(stream, "stream");
			String durableName = requireNonBlank(durable, "durable");

			ConsumerInfo ci = manager.jetStreamManagement().getConsumerInfo(streamName, durableName);
			ConsumerConfiguration cc = ci.getConsumerConfiguration();

			return new ConsumerInfoResponse(streamName, durableName,
					cc == null ? List.of() : cc.getFilterSubjects(),
					cc == null ? null : safeEnumName(cc.getAckPolicy()),
					ci.getNumPending(), ci.getNumAckPending(), ci.getNumWaiting(),
					sequence(ci.getDelivered()), sequence(ci.getAckFloor()));
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@DeleteMapping("/streams/{stream}/consumers/{durable}")
	public Mono<DeleteConsumerResponse> deleteConsumer(@PathVariable("stream") String stream,
			@PathVariable("durable") String durable) {
		return Mono.fromCallable(() -> {
			String streamName = requireNonBlank(stream, "stream");
			String durableName = requireNonBlank(durable, "durable");

			JetStreamManagement jsm = manager.jetStreamManagement();
			boolean deleted = jsm.deleteConsumer(streamName, durableName);
			log.info("Admin delete consumer stream={} durable={} deleted={}", streamName, durableName, deleted);
			return new DeleteConsumerResponse(streamName, durableName, deleted);
		}).subscribeOn(Schedulers.boundedElastic());
	}

	// ---------------------------------------------------------------------
	// DTOs
	// ---------------------------------------------------------------------

	public record HealthResponse(String status, String client, String connectionState, String connectedUrl,
			String timestamp) {
	}

	public record StreamInfoResponse(String name, List<String> subjects, String retention, String storage,
			Duration maxAge, Long messages, Long bytes, Long firstSeq, Long lastSeq, Long consumerCount) {
	}

	public record ConsumerInfoResponse(String stream, String durable, List<String> filterSubjects,
			String ackPolicy, long numPending, long numAckPending, long numWaiting, SequenceResponse delivered,
			SequenceResponse ackFloor) {
	}

	public record SequenceResponse(long consumerSeq, long streamSeq) {
	}

	public record DeleteConsumerResponse(String stream, String durable, boolean deleted) {
	}

	// ---------------------------------------------------------------------
	// Small helpers
	// ---------------------------------------------------------------------

	private static SequenceResponse sequence(SequenceInfo info) {
		return info == null ? null : new SequenceResponse(info.getConsumerSequence(), info.getStreamSequence());
	}

	private static String requireNonBlank(String v, String field) {
		if (v == null || v.isBlank()) {
			throw new IllegalArgumentException(field + " is required");
		}
		return v.trim();
	}

	private static String safeEnumName(Enum<?> e) {
		return e == null ? null : e.name().toUpperCase(Locale.ROOT);
	}
}
