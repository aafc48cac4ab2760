package com.rms.weather.jetstream.bootstrap;

/**
 * Published once the configured streams exist, so consumers can subscribe
 * without waiting for their retry interval.
 */
public record JetStreamBootstrapCompleteEvent(int streams) {
}
