package com.rms.weather.core.store;

/**
 * A read could not gather responses from the required number of replicas.
 */
public class ReadUnavailableException extends TransientStoreException {

    public ReadUnavailableException(String message, int requiredAcks, int aliveReplicas, Throwable cause) {
        super(message, requiredAcks, aliveReplicas, cause);
    }

    public ReadUnavailableException(String message, int requiredAcks, int aliveReplicas) {
        this(message, requiredAcks, aliveReplicas, null);
    }
}
