package com.rms.weather.consumer;

/** Final result of handling one stream message. */
public enum IngestOutcome {

    /** Written to the store with the write quorum; acked. */
    APPLIED,

    /** Payload could not be decoded; dead-lettered and acked. */
    DEAD_LETTERED_DECODE,

    /** Store write gave up (retries exhausted or rejected); dead-lettered and acked. */
    DEAD_LETTERED_WRITE,

    /** Handling failed on the last allowed delivery; dead-lettered and acked. */
    DEAD_LETTERED_DELIVERY,

    /** Handling failed unexpectedly; left unacked for redelivery. */
    UNACKED
}
