package com.rms.weather.consumer;

import com.rms.weather.jetstream.bootstrap.JetStreamBootstrapCompleteEvent;
import com.rms.weather.jetstream.bootstrap.JetStreamBootstrapper;
import com.rms.weather.jetstream.config.NatsProperties;
import com.rms.weather.jetstream.naming.ConsumerName;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * =====================================================================
 * ObservationStreamConsumer
 * =====================================================================
 *
 * Reads the observation stream and hands every message to
 * {@link ObservationIngestor}.
 *
 * PARTITIONS
 * ----------
 * One loop per entry of weather.consumer.partitions. Each loop has
 *  - its own durable pull consumer ({@link ConsumerName#of(String, int)})
 *  - its own single-threaded scheduler for the blocking NATS calls
 *  - strictly sequential message handling, so a partition's messages are
 *    applied in stream order
 *
 * LOOP
 * ----
 *  subscribe (stream missing -> retry every 2s)
 *    -> every poll-interval: pull(batch-size), drain, ingest one by one
 *    -> on failure: unsubscribe, wait, subscribe again
 *
 * Ticks that arrive while a batch is still being handled are dropped.
 *
 * DELIVERY
 * --------
 * Durable + explicit ack + DeliverPolicy.All: a new durable replays the stream
 * from the start, a restarted one resumes after its last acked message.
 * Redelivery is capped by max-deliver; the ingestor dead-letters a message on
 * its last delivery.
 *
 * Requires both weather.consumer.enabled and weather.nats.enabled (default true).
 *
 * SHUTDOWN
 * --------
 * {@link #destroy()} disposes every loop (the cancellation signal) and the
 * partition schedulers.
 */
@Component
@ConditionalOnExpression("${weather.consumer.enabled:true} and ${weather.nats.enabled:true}")
public class ObservationStreamConsumer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ObservationStreamConsumer.class);

    private static final Duration SUBSCRIBE_RETRY_INTERVAL = Duration.ofSeconds(2);

    private static final Duration NEXT_MESSAGE_POLL = Duration.ofMillis(250);

    private final JetStream js;
    private final ObservationIngestor ingestor;
    private final IngestionProperties props;
    private final String nodeId;

    private final AtomicBoolean started = new AtomicBoolean();
    private final List<PartitionLoop> loops = Collections.synchronizedList(new ArrayList<>());

    public ObservationStreamConsumer(JetStream js,
                                     ObservationIngestor ingestor,
                                     IngestionProperties props,
                                     NatsProperties natsProps) {
        this.js = js;
        this.ingestor = ingestor;
        this.props = props;
        this.nodeId = natsProps.getNodeId();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(JetStreamBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        startIfNotStarted();
    }

    void startIfNotStarted() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        List<String> partitions = props.getPartitions();
        if (partitions.isEmpty()) {
            log.warn("No partitions configured (weather.consumer.partitions); nothing to consume");
            return;
        }
        for (int i = 0; i < partitions.size(); i++) {
            loops.add(startPartition(i, partitions.get(i)));
        }
        log.info("Started {} partition loop(s) on stream={} node={}", loops.size(), props.getStream(), nodeId);
    }

    /** Durable names of the running partition loops, in partition order. */
    public List<String> durables() {
        synchronized (loops) {
            List<String> out = new ArrayList<>(loops.size());
            for (PartitionLoop l : loops) {
                out.add(l.durable());
            }
            return out;
        }
    }

    private PartitionLoop startPartition(int index, String filterSubject) {
        String durable = ConsumerName.of(nodeId, index);
        Scheduler scheduler = Schedulers.newSingle("weather-consumer-p" + index);

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(props.getStream())
                .configuration(consumerConfiguration(durable, filterSubject))
                .build();

        Disposable d = Mono.defer(() -> subscribeAndConsume(pso, filterSubject, durable, scheduler))
                .subscribeOn(scheduler)
                .onErrorResume(err -> {
                    log.warn("Consumer loop ended with error. Will retry subscription. stream={} durable={} err={}",
                            props.getStream(), durable, err.toString());
                    return Mono.empty();
                })
                .repeatWhen(done -> done.delayElements(SUBSCRIBE_RETRY_INTERVAL))
                .subscribe(
                        v -> { },
                        err -> log.error("Consumer supervisor terminated unexpectedly: durable={} err={}",
                                durable, err.toString(), err));

        return new PartitionLoop(durable, filterSubject, scheduler, d);
    }

    ConsumerConfiguration consumerConfiguration(String durable, String filterSubject) {
        return ConsumerConfiguration.builder()
                .durable(durable)
                .deliverPolicy(DeliverPolicy.All)
                .replayPolicy(ReplayPolicy.Instant)
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(props.getAckWait())
                .maxDeliver(props.getMaxDeliver())
                .filterSubject(filterSubject)
                .build();
    }

    private Mono<Void> subscribeAndConsume(PullSubscribeOptions pso, String filterSubject, String durable,
                                           Scheduler scheduler) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(filterSubject, pso);
                        log.info("Subscribed: stream={} filter={} durable={}", props.getStream(), filterSubject, durable);
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JetStreamBootstrapper.JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", props.getStream());
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub, scheduler)
                        .doFinally(sig -> unsubscribe(sub, durable)));
    }

    private Mono<Void> consumePullLoop(JetStreamSubscription sub, Scheduler scheduler) {
        return Flux.interval(props.getPollInterval())
                .onBackpressureDrop()
                .concatMap(tick -> drainBatch(sub, scheduler), 1)
                .then();
    }

    private Flux<IngestOutcome> drainBatch(JetStreamSubscription sub, Scheduler scheduler) {
        return Flux.defer(() -> {
                    sub.pull(props.getBatchSize());
                    return Flux.<Message>generate(sink -> {
                        try {
                            Message m = sub.nextMessage(NEXT_MESSAGE_POLL);
                            if (m == null) {
                                sink.complete();
                            } else {
                                sink.next(m);
                            }
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            sink.complete();
                        } catch (Exception e) {
                            sink.error(e);
                        }
                    });
                })
                .subscribeOn(scheduler)
                .filter(Message::isJetStream)
                .map(NatsInboundMessage::new)
                .concatMap(ingestor::process);
    }

    private static void unsubscribe(JetStreamSubscription sub, String durable) {
        try {
            sub.unsubscribe();
        } catch (IllegalStateException e) {
            log.debug("Unsubscribe failed for durable={}: {}", durable, e.toString());
        }
    }

    @Override
    public void destroy() {
        synchronized (loops) {
            for (PartitionLoop l : loops) {
                if (!l.loop().isDisposed()) {
                    l.loop().dispose();
                }
                l.scheduler().dispose();
            }
            log.info("Stopped {} partition loop(s)", loops.size());
            loops.clear();
        }
    }

    private record PartitionLoop(String durable, String filterSubject, Scheduler scheduler, Disposable loop) {
    }
}
