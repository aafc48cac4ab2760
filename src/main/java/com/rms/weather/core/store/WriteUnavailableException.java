package com.rms.weather.core.store;

/**
 * A write could not be acknowledged by the required number of replicas.
 */
public class WriteUnavailableException extends TransientStoreException {

    public WriteUnavailableException(String message, int requiredAcks, int aliveReplicas, Throwable cause) {
        super(message, requiredAcks, aliveReplicas, cause);
    }

    public WriteUnavailableException(String message, int requiredAcks, int aliveReplicas) {
        this(message, requiredAcks, aliveReplicas, null);
    }
}
