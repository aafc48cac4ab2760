package com.rms.weather.consumer;

import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.codec.ObservationCodec;
import com.rms.weather.core.codec.ObservationDecodeException;
import com.rms.weather.core.deadletter.DeadLetter;
import com.rms.weather.core.deadletter.DeadLetterReason;
import com.rms.weather.core.deadletter.DeadLetterSink;
import com.rms.weather.core.deadletter.LoggingDeadLetterSink;
import com.rms.weather.core.model.Observation;
import com.rms.weather.core.quorum.QuorumPolicy;
import com.rms.weather.core.quorum.QuorumSettings;
import com.rms.weather.core.store.StationStore;
import com.rms.weather.core.store.StoreRejectedException;
import com.rms.weather.core.store.TransientStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * =====================================================================
 * ObservationIngestor
 * =====================================================================
 *
 * Handles one stream message end to end: decode, write, checkpoint.
 *
 * FLOW
 * ----
 *  1. decode the payload
 *       failure -> dead letter DECODE_FAILED, ack
 *  2. upsert with the write quorum
 *       TransientStoreException -> exponential backoff, up to max-attempts
 *       retries exhausted       -> dead letter WRITE_EXHAUSTED, ack
 *       StoreRejectedException  -> dead letter WRITE_REJECTED, ack
 *  3. ack
 *
 * Anything else leaves the message unacked, so JetStream redelivers it, until
 * the delivery count reaches max-deliver: that last delivery is dead-lettered
 * as DELIVERY_EXHAUSTED and acked. Writes are idempotent upserts, which makes
 * redelivery and duplicate delivery safe.
 *
 * A dead-letter sink failure is logged and does not block the ack.
 */
@Component
public class ObservationIngestor {

    private static final Logger log = LoggerFactory.getLogger(ObservationIngestor.class);

    private final ObservationCodec codec;
    private final StationStore store;
    private final QuorumPolicy writeQuorum;
    private final IngestionProperties props;
    private final DeadLetterSink deadLetters;
    private final IngestionStats stats;

    @Autowired
    public ObservationIngestor(ObservationCodec codec,
                               StationStore store,
                               QuorumSettings quorum,
                               IngestionProperties props,
                               ObjectProvider<DeadLetterSink> deadLetters,
                               IngestionStats stats) {
        this(codec, store, quorum, props, deadLetters.getIfAvailable(LoggingDeadLetterSink::new), stats);
    }

    public ObservationIngestor(ObservationCodec codec,
                               StationStore store,
                               QuorumSettings quorum,
                               IngestionProperties props,
                               DeadLetterSink deadLetters,
                               IngestionStats stats) {
        if (props.getMaxAttempts() < 1) {
            throw new ConfigurationException("weather.consumer.max-attempts must be >= 1");
        }
        if (props.getMaxDeliver() < 1) {
            throw new ConfigurationException("weather.consumer.max-deliver must be >= 1");
        }
        this.codec = codec;
        this.store = store;
        this.writeQuorum = quorum.write();
        this.props = props;
        this.deadLetters = deadLetters;
        this.stats = stats;
        log.info("Ingestor ready (writeQuorum={}, maxAttempts={}, backoff={}..{}, maxDeliver={}, deadLetters={})",
                writeQuorum, props.getMaxAttempts(), props.getInitialBackoff(), props.getMaxBackoff(),
                props.getMaxDeliver(), deadLetters.getClass().getSimpleName());
    }

    /**
     * Ingests the message and acks it once the outcome is final. Never errors:
     * unexpected failures yield {@link IngestOutcome#UNACKED}, or
     * {@link IngestOutcome#DEAD_LETTERED_DELIVERY} on the last allowed delivery.
     */
    public Mono<IngestOutcome> process(InboundMessage msg) {
        return ingest(msg)
                .onErrorResume(e -> msg.deliveryCount() >= props.getMaxDeliver(), e -> giveUpDelivery(msg, e))
                .flatMap(outcome -> ack(msg).thenReturn(outcome))
                .onErrorResume(e -> {
                    stats.unacked();
                    log.warn("Message handling failed; message not acked. id={} subject={} delivery={}/{} err={}",
                            msg.sourceId(), msg.subject(), msg.deliveryCount(), props.getMaxDeliver(),
                            e.toString(), e);
                    return Mono.just(IngestOutcome.UNACKED);
                });
    }

    private Mono<IngestOutcome> giveUpDelivery(InboundMessage msg, Throwable e) {
        stats.deliveryDeadLetter();
        log.error("Giving up on id={} subject={} after {} deliveries: {}",
                msg.sourceId(), msg.subject(), msg.deliveryCount(), e.toString(), e);
        DeadLetter dl = new DeadLetter(DeadLetterReason.DELIVERY_EXHAUSTED, msg.subject(), msg.sourceId(),
                msg.data(), null, e.toString(), (int) Math.min(msg.deliveryCount(), Integer.MAX_VALUE), Instant.now());
        return deadLetter(dl).thenReturn(IngestOutcome.DEAD_LETTERED_DELIVERY);
    }

    /** Decode and write, without acking. */
    Mono<IngestOutcome> ingest(InboundMessage msg) {
        Observation observation;
        try {
            observation = codec.decode(msg.data());
        } catch (ObservationDecodeException e) {
            stats.decodeFailure();
            log.warn("Undecodable observation id={} subject={} delivery={}: {} payload={}",
                    msg.sourceId(), msg.subject(), msg.deliveryCount(), e.getMessage(), e.getPayloadPreview());
            DeadLetter dl = new DeadLetter(DeadLetterReason.DECODE_FAILED, msg.subject(), msg.sourceId(),
                    msg.data(), e.getField(), e.getReason(), 0, Instant.now());
            return deadLetter(dl).thenReturn(IngestOutcome.DEAD_LETTERED_DECODE);
        }
        return write(msg, observation);
    }

    private Mono<IngestOutcome> write(InboundMessage msg, Observation o) {
        AtomicInteger attempts = new AtomicInteger();

        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return store.upsert(o, writeQuorum);
                })
                .retryWhen(retrySpec(o))
                .then(Mono.fromCallable(() -> {
                    stats.applied();
                    log.debug("Applied station={} date={} id={} attempts={}",
                            o.stationId(), o.date(), msg.sourceId(), attempts.get());
                    return IngestOutcome.APPLIED;
                }))
                .onErrorResume(e -> e instanceof TransientStoreException || e instanceof StoreRejectedException, e -> {
                    DeadLetterReason reason = e instanceof TransientStoreException
                            ? DeadLetterReason.WRITE_EXHAUSTED
                            : DeadLetterReason.WRITE_REJECTED;
                    stats.writeDeadLetter();
                    log.error("Giving up on station={} date={} id={} after {} attempt(s): {} ({})",
                            o.stationId(), o.date(), msg.sourceId(), attempts.get(), reason, e.getMessage());
                    DeadLetter dl = new DeadLetter(reason, msg.subject(), msg.sourceId(), msg.data(), null,
                            e.getMessage(), attempts.get(), Instant.now());
                    return deadLetter(dl).thenReturn(IngestOutcome.DEAD_LETTERED_WRITE);
                });
    }

    private RetryBackoffSpec retrySpec(Observation o) {
        return Retry.backoff(props.getMaxAttempts() - 1L, props.getInitialBackoff())
                .maxBackoff(props.getMaxBackoff())
                .jitter(props.getJitter())
                .filter(TransientStoreException.class::isInstance)
                .doBeforeRetry(signal -> {
                    stats.retry();
                    log.debug("Retrying write station={} date={} (retry {}): {}",
                            o.stationId(), o.date(), signal.totalRetries() + 1, signal.failure().getMessage());
                })
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private Mono<Void> deadLetter(DeadLetter dl) {
        return deadLetters.record(dl)
                .onErrorResume(e -> {
                    log.error("Dead-letter sink failed for id={} reason={}: {}",
                            dl.sourceId(), dl.reason(), e.toString(), e);
                    return Mono.empty();
                });
    }

    private Mono<Void> ack(InboundMessage msg) {
        return Mono.fromRunnable(msg::ack)
                .onErrorResume(e -> {
                    // The message is redelivered; the write is idempotent.
                    log.warn("Ack failed id={} subject={}: {}", msg.sourceId(), msg.subject(), e.toString());
                    return Mono.empty();
                })
                .then();
    }
}
