package com.rms.weather.core.store;

import com.rms.weather.core.model.Observation;
import com.rms.weather.core.model.TemperatureReading;
import com.rms.weather.core.quorum.QuorumPolicy;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Typed access to the replicated {@code stations} table.
 *
 * <p>Every operation takes the {@link QuorumPolicy} it must satisfy. Failures
 * to meet it surface as {@link WriteUnavailableException} or
 * {@link ReadUnavailableException}; implementations never silently fall back
 * to a weaker quorum.</p>
 *
 * <p>Implementations are shared by the stream consumer and the query service
 * and must be safe for concurrent use.</p>
 */
public interface StationStore {

    /**
     * Writes the observation's temperature record under {@code (stationId, date)},
     * replacing any previous value for that key, and the station's static name
     * when the observation carries one.
     */
    Mono<Void> upsert(Observation observation, QuorumPolicy quorum);

    /**
     * Reads the station's static name. Completes empty when the partition does
     * not exist or has no name.
     */
    Mono<String> readName(String stationId, QuorumPolicy quorum);

    /**
     * Reads every observation of the station in ascending date order. Completes
     * empty when the partition has no observations.
     */
    Flux<TemperatureReading> readObservations(String stationId, QuorumPolicy quorum);
}
