package com.rms.weather.core.store;

/**
 * The store refused an operation for a reason retrying will not fix
 * (invalid statement, schema mismatch, oversized value).
 */
public class StoreRejectedException extends RuntimeException {

    public StoreRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
