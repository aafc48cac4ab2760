package com.rms.weather.core.store;

/**
 * The store could not satisfy the requested quorum right now (too few replicas
 * alive, or replicas did not answer within the request timeout).
 *
 * Callers may retry. Writes on the ingestion path are retried with backoff;
 * reads are surfaced to the caller as "unavailable" and never downgraded to a
 * weaker quorum.
 */
public class TransientStoreException extends RuntimeException {

    private final int requiredAcks;
    private final int aliveReplicas;

    public TransientStoreException(String message, int requiredAcks, int aliveReplicas, Throwable cause) {
        super(message, cause);
        this.requiredAcks = requiredAcks;
        this.aliveReplicas = aliveReplicas;
    }

    /** Replicas the operation needed. */
    public int getRequiredAcks() {
        return requiredAcks;
    }

    /** Replicas known to be alive when the operation failed, or -1 when unknown. */
    public int getAliveReplicas() {
        return aliveReplicas;
    }
}
