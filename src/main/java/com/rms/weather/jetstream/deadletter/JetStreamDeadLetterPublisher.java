package com.rms.weather.jetstream.deadletter;

import com.rms.weather.core.deadletter.DeadLetter;
import com.rms.weather.core.deadletter.DeadLetterSink;
import io.nats.client.JetStream;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Publishes skipped messages to {@code weather.deadletter.<reason>}.
 *
 * <p>The skipped message's payload is the body, untouched. Diagnostics travel
 * as headers. The message id is derived from the source message identity, so
 * a dead letter re-published after a redelivery is dropped by JetStream's
 * duplicate window.</p>
 */
public class JetStreamDeadLetterPublisher implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(JetStreamDeadLetterPublisher.class);

    public static final String SUBJECT_PREFIX = "weather.deadletter.";

    public static final String H_REASON = "Weather-DL-Reason";
    public static final String H_SOURCE = "Weather-DL-Source";
    public static final String H_SOURCE_ID = "Weather-DL-Source-Id";
    public static final String H_FIELD = "Weather-DL-Field";
    public static final String H_DETAIL = "Weather-DL-Detail";
    public static final String H_ATTEMPTS = "Weather-DL-Attempts";
    public static final String H_OCCURRED_AT = "Weather-DL-Occurred-At";
    public static final String H_NODE = "Weather-DL-Node";

    private static final int DETAIL_LIMIT = 1024;

    private final JetStream js;
    private final String nodeId;

    public JetStreamDeadLetterPublisher(JetStream js, String nodeId) {
        this.js = js;
        this.nodeId = nodeId;
    }

    @Override
    public Mono<Void> record(DeadLetter dl) {
        return Mono.fromCallable(() -> {
                    String subject = subjectFor(dl);
                    PublishOptions opts = PublishOptions.builder()
                            .messageId("dl-" + dl.sourceId())
                            .build();
                    byte[] body = dl.payload() == null ? new byte[0] : dl.payload();

                    PublishAck ack = js.publish(subject, headersFor(dl), body, opts);

                    log.info("Dead-lettered id={} reason={} subject={} stream={} seq={}",
                            dl.sourceId(), dl.reason(), subject, ack.getStream(), ack.getSeqno());
                    return ack;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    public static String subjectFor(DeadLetter dl) {
        return SUBJECT_PREFIX + dl.reason().token();
    }

    Headers headersFor(DeadLetter dl) {
        Headers h = new Headers();
        h.add(H_REASON, dl.reason().name());
        h.add(H_SOURCE, nullToEmpty(dl.source()));
        h.add(H_SOURCE_ID, nullToEmpty(dl.sourceId()));
        h.add(H_ATTEMPTS, String.valueOf(dl.attempts()));
        h.add(H_OCCURRED_AT, dl.occurredAt().toString());
        h.add(H_NODE, nodeId);
        if (dl.field() != null) {
            h.add(H_FIELD, dl.field());
        }
        if (dl.detail() != null) {
            h.add(H_DETAIL, singleLine(dl.detail()));
        }
        return h;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    // Header values may not contain CR/LF.
    private static String singleLine(String s) {
        String v = s.replace('\r', ' ').replace('\n', ' ');
        return v.length() > DETAIL_LIMIT ? v.substring(0, DETAIL_LIMIT) : v;
    }
}
