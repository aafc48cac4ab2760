package com.rms.weather.query;

import com.rms.weather.core.model.Observation;
import com.rms.weather.core.model.TemperatureReading;
import com.rms.weather.core.quorum.QuorumSettings;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.core.store.StationStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * =====================================================================
 * StationQueryService
 * =====================================================================
 *
 * Read side of the service, plus direct writes of single records.
 *
 * CONSISTENCY
 * -----------
 *  - reads use the read quorum R, writes the write quorum W
 *  - with R + W > RF every read observes every write acknowledged before it
 *  - a read that cannot reach R replicas fails with
 *    {@link com.rms.weather.core.store.ReadUnavailableException}; it is never
 *    retried at a weaker quorum
 *
 * Station ids are trimmed, as the codec trims them on ingestion. A blank id
 * fails the returned publisher with {@link IllegalArgumentException}.
 *
 * Stateless: every call goes to the store.
 */
@Service
public class StationQueryService {

    private static final Logger log = LoggerFactory.getLogger(StationQueryService.class);

    private final StationStore store;
    private final StationSchema schema;
    private final QuorumSettings quorum;

    public StationQueryService(StationStore store, StationSchema schema, QuorumSettings quorum) {
        this.store = store;
        this.schema = schema;
        this.quorum = quorum;
    }

    public SchemaDescription stationSchema() {
        return SchemaDescription.of(schema, quorum.write().requiredAcks(), quorum.read().requiredAcks());
    }

    /** The station's name; {@link StationNotFoundException} when unknown or unnamed. */
    public Mono<String> stationName(String stationId) {
        return Mono.defer(() -> {
            String id = requireStationId(stationId);
            return store.readName(id, quorum.read())
                    .switchIfEmpty(Mono.error(() -> new StationNotFoundException(id, "name")));
        });
    }

    /** Highest tmax over all of the station's observations. */
    public Mono<Integer> stationMax(String stationId) {
        return Mono.defer(() -> {
            String id = requireStationId(stationId);
            return store.readObservations(id, quorum.read())
                    .map(TemperatureReading::tmax)
                    .reduce(Integer::max)
                    .switchIfEmpty(Mono.error(() -> new StationNotFoundException(id, "observations")));
        });
    }

    /** Upserts one record with the write quorum. */
    public Mono<Void> recordTemps(String stationId, LocalDate date, Integer tmin, int tmax) {
        return Mono.defer(() -> {
            String id = requireStationId(stationId);
            if (date == null) {
                return Mono.error(new IllegalArgumentException("date is required"));
            }
            Observation o = new Observation(id, date, null, tmin, tmax);
            return store.upsert(o, quorum.write())
                    .doOnSuccess(v -> log.debug("Recorded station={} date={} tmax={}", id, date, tmax));
        });
    }

    private static String requireStationId(String stationId) {
        if (stationId == null || stationId.isBlank()) {
            throw new IllegalArgumentException("station id is required");
        }
        return stationId.trim();
    }
}
