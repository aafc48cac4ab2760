package com.rms.weather.core.deadletter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Records dead letters in the application log only. Used when publishing to
 * the dead-letter stream is disabled.
 */
public class LoggingDeadLetterSink implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterSink.class);

    private static final int BODY_LIMIT = 512;

    @Override
    public Mono<Void> record(DeadLetter dl) {
        return Mono.fromRunnable(() -> log.warn(
                "Dead letter reason={} source={} id={} field={} attempts={} detail={} body={}",
                dl.reason(), dl.source(), dl.sourceId(), dl.field(), dl.attempts(), dl.detail(), body(dl.payload())));
    }

    private static String body(byte[] payload) {
        if (payload == null) {
            return "";
        }
        String s = new String(payload, StandardCharsets.UTF_8);
        return s.length() > BODY_LIMIT ? s.substring(0, BODY_LIMIT) + "..." : s;
    }
}
