package com.rms.weather.core.deadletter;

import reactor.core.publisher.Mono;

/**
 * Destination for messages the consumer skips.
 */
public interface DeadLetterSink {

    Mono<Void> record(DeadLetter deadLetter);
}
