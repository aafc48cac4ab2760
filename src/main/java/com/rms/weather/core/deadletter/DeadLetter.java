package com.rms.weather.core.deadletter;

import java.time.Instant;

/**
 * A stream message the consumer gave up on, with enough context to inspect or
 * replay it later.
 *
 * @param reason     why it was skipped
 * @param source     stream subject the message arrived on
 * @param sourceId   stable identity of the message in its stream (stream + sequence), used for dedup
 * @param payload    the raw message body, untouched
 * @param field      the violated field for decode failures, otherwise null
 * @param detail     human-readable cause
 * @param attempts   write attempts made (0 for decode failures)
 * @param occurredAt when the consumer gave up
 */
public record DeadLetter(
        DeadLetterReason reason,
        String source,
        String sourceId,
        byte[] payload,
        String field,
        String detail,
        int attempts,
        Instant occurredAt
) {
}
