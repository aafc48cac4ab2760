package com.rms.weather.admin;

import com.rms.weather.api.ApiError;
import com.rms.weather.consumer.IngestionProperties;
import com.rms.weather.consumer.IngestionStats;
import com.rms.weather.jetstream.bootstrap.JetStreamBootstrapper;
import com.rms.weather.jetstream.config.NatsProperties;
import com.rms.weather.jetstream.naming.ConsumerName;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.ConsumerInfo;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.api.StreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Operational view of ingestion. Off unless {@code weather.admin.enabled=true};
 * also off when NATS is disabled.
 *
 * <ul>
 *   <li>{@code GET /admin/ingestion/stats}</li>
 *   <li>{@code GET /admin/ingestion/consumers}</li>
 *   <li>{@code GET /admin/ingestion/streams/{name}}</li>
 * </ul>
 *
 * JetStream management calls block, so they run on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping(path = "/admin/ingestion", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnExpression("${weather.admin.enabled:false} and ${weather.nats.enabled:true}")
public class IngestionAdminController {

	private static final Logger log = LoggerFactory.getLogger(IngestionAdminController.class);

	private final JetStreamManagement jsm;
	private final IngestionStats stats;
	private final IngestionProperties ingestionProps;
	private final NatsProperties natsProps;

	public IngestionAdminController(JetStreamManagement jsm, IngestionStats stats,
			IngestionProperties ingestionProps, NatsProperties natsProps) {
		this.jsm = jsm;
		this.stats = stats;
		this.ingestionProps = ingestionProps;
		this.natsProps = natsProps;
	}

	@GetMapping("/stats")
	public IngestionStats.Snapshot stats() {
		return stats.snapshot();
	}

	@GetMapping("/consumers")
	public Mono<List<ConsumerStateResponse>> consumers() {
		return Mono.fromCallable(() -> {
			List<ConsumerStateResponse> out = new ArrayList<>();
			List<String> partitions = ingestionProps.getPartitions();
			for (int i = 0; i < partitions.size(); i++) {
				String durable = ConsumerName.of(natsProps.getNodeId(), i);
				out.add(consumerState(i, partitions.get(i), durable));
			}
			return out;
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@GetMapping("/streams/{name}")
	public Mono<StreamInfoResponse> stream(@PathVariable("name") String name) {
		if (name == null || name.isBlank()) {
			return Mono.error(new IllegalArgumentException("name is required"));
		}
		return Mono.fromCallable(() -> {
			StreamInfo si = jsm.getStreamInfo(name.trim());
			StreamConfiguration cfg = si.getConfiguration();
			StreamState ss = si.getStreamState();
			return new StreamInfoResponse(cfg.getName(), cfg.getSubjects() == null ? List.of() : cfg.getSubjects(),
					cfg.getRetentionPolicy() == null ? null : cfg.getRetentionPolicy().name(), cfg.getMaxAge(),
					ss == null ? null : ss.getMsgCount(), ss == null ? null : ss.getByteCount(),
					ss == null ? null : ss.getFirstSequence(), ss == null ? null : ss.getLastSequence(),
					ss == null ? null : ss.getConsumerCount());
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private ConsumerStateResponse consumerState(int partition, String filterSubject, String durable)
			throws IOException {
		try {
			ConsumerInfo ci = jsm.getConsumerInfo(ingestionProps.getStream(), durable);
			return new ConsumerStateResponse(partition, filterSubject, durable, true, ci.getNumPending(),
					ci.getNumAckPending(), ci.getRedelivered(),
					ci.getDelivered() == null ? null : ci.getDelivered().getStreamSequence(),
					ci.getAckFloor() == null ? null : ci.getAckFloor().getStreamSequence());
		} catch (JetStreamApiException e) {
			log.debug("No consumer state for durable={}: {}", durable, e.getMessage());
			return new ConsumerStateResponse(partition, filterSubject, durable, false, 0, 0, 0, null, null);
		}
	}

	// ---------------------------------------------------------------------
	// DTOs
	// ---------------------------------------------------------------------

	public record ConsumerStateResponse(int partition, String filterSubject, String durable, boolean exists,
			long numPending, long numAckPending, long numRedelivered, Long deliveredStreamSeq,
			Long ackFloorStreamSeq) {
	}

	public record StreamInfoResponse(String name, List<String> subjects, String retention, Duration maxAge,
			Long messages, Long bytes, Long firstSeq, Long lastSeq, Long consumerCount) {
	}
}

@RestControllerAdvice(assignableTypes = IngestionAdminController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
class IngestionAdminExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(IngestionAdminExceptionHandler.class);

	@ExceptionHandler(JetStreamApiException.class)
	public ResponseEntity<ApiError> jetStream(JetStreamApiException e) {
		if (e.getApiErrorCode() == JetStreamBootstrapper.JS_STREAM_NOT_FOUND_ERR) {
			return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", e.getErrorDescription()));
		}
		log.error("Admin JetStream call failed", e);
		return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ApiError("jetstream_error", e.getErrorDescription()));
	}
}
