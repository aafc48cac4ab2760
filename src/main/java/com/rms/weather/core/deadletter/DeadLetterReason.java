package com.rms.weather.core.deadletter;

import java.util.Locale;

/**
 * Why a stream message was skipped instead of applied.
 */
public enum DeadLetterReason {

    /** Payload was not a well-formed observation. */
    DECODE_FAILED,

    /** The store stayed unavailable through every write attempt. */
    WRITE_EXHAUSTED,

    /** The store rejected the write outright; retrying would not help. */
    WRITE_REJECTED,

    /** Redelivered max-deliver times without ever reaching a final outcome. */
    DELIVERY_EXHAUSTED;

    /** Subject token, e.g. {@code decode-failed}. */
    public String token() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
