package com.rms.weather.cassandra.store;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.ConsistencyLevel;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.connection.ClosedConnectionException;
import com.datastax.oss.driver.api.core.data.UdtValue;
import com.datastax.oss.driver.api.core.servererrors.BootstrappingException;
import com.datastax.oss.driver.api.core.servererrors.OverloadedException;
import com.datastax.oss.driver.api.core.servererrors.QueryConsistencyException;
import com.datastax.oss.driver.api.core.servererrors.QueryValidationException;
import com.datastax.oss.driver.api.core.servererrors.ServerError;
import com.datastax.oss.driver.api.core.servererrors.UnavailableException;
import com.datastax.oss.driver.api.core.type.UserDefinedType;
import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.model.Observation;
import com.rms.weather.core.model.TemperatureReading;
import com.rms.weather.core.quorum.QuorumPolicy;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.core.store.ReadUnavailableException;
import com.rms.weather.core.store.StationStore;
import com.rms.weather.core.store.StoreRejectedException;
import com.rms.weather.core.store.WriteUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDate;

import static com.rms.weather.core.schema.StationSchema.COL_DATE;
import static com.rms.weather.core.schema.StationSchema.COL_ID;
import static com.rms.weather.core.schema.StationSchema.COL_NAME;
import static com.rms.weather.core.schema.StationSchema.COL_RECORD;
import static com.rms.weather.core.schema.StationSchema.FIELD_TMAX;
import static com.rms.weather.core.schema.StationSchema.FIELD_TMIN;

/**
 * =====================================================================
 * CassandraStationStore
 * =====================================================================
 *
 * {@link StationStore} on top of a shared {@link CqlSession}.
 *
 * STATEMENTS
 * ----------
 *  - upsert      : INSERT INTO stations (id, date, [name,] record) VALUES (...)
 *  - read name   : SELECT name FROM stations WHERE id = ? LIMIT 1
 *  - read rows   : SELECT date, record FROM stations WHERE id = ?
 *
 * Cassandra INSERT is an upsert: the same (id, date) overwrites in place and
 * the static name cell is resolved last-write-wins by write timestamp. The
 * clustering order guarantees rows come back sorted by date.
 *
 * CONSISTENCY
 * -----------
 * Each bound statement gets the consistency level matching the caller's
 * {@link QuorumPolicy} and the configured request timeout.
 *
 * ERROR MAPPING
 * -------------
 *  - Unavailable, read/write timeout, no node reachable, driver timeout,
 *    overloaded or bootstrapping coordinator, server error, closed connection
 *      -> {@link WriteUnavailableException} or {@link ReadUnavailableException}
 *  - invalid query or schema problems -> {@link StoreRejectedException}
 *
 * THREADING
 * ---------
 * Driver calls are blocking here and run on Reactor's bounded-elastic
 * scheduler, never on the caller's thread. Statements are prepared on first
 * use; the driver caches prepared statements per query string.
 */
public class CassandraStationStore implements StationStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraStationStore.class);

    private final CqlSession session;
    private final StationSchema schema;
    private final Duration requestTimeout;

    private final String insertWithName;
    private final String insertRecordOnly;
    private final String selectName;
    private final String selectRecords;

    public CassandraStationStore(CqlSession session, StationSchema schema, Duration requestTimeout) {
        this.session = session;
        this.schema = schema;
        this.requestTimeout = requestTimeout;

        String table = schema.qualifiedTable();
        this.insertWithName = "INSERT INTO " + table + " (" + COL_ID + ", " + COL_DATE + ", " + COL_NAME + ", "
                + COL_RECORD + ") VALUES (?, ?, ?, ?)";
        this.insertRecordOnly = "INSERT INTO " + table + " (" + COL_ID + ", " + COL_DATE + ", " + COL_RECORD
                + ") VALUES (?, ?, ?)";
        this.selectName = "SELECT " + COL_NAME + " FROM " + table + " WHERE " + COL_ID + " = ? LIMIT 1";
        this.selectRecords = "SELECT " + COL_DATE + ", " + COL_RECORD + " FROM " + table + " WHERE " + COL_ID + " = ?";
    }

    @Override
    public Mono<Void> upsert(Observation o, QuorumPolicy quorum) {
        return Mono.fromCallable(() -> {
                    UdtValue record = toRecord(o);
                    BoundStatement stmt = o.hasName()
                            ? session.prepare(insertWithName).bind(o.stationId(), o.date(), o.name(), record)
                            : session.prepare(insertRecordOnly).bind(o.stationId(), o.date(), record);
                    session.execute(withQuorum(stmt, quorum));
                    log.debug("Upserted station={} date={} quorum={}", o.stationId(), o.date(), quorum);
                    return o;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> translateWrite(e, quorum))
                .then();
    }

    @Override
    public Mono<String> readName(String stationId, QuorumPolicy quorum) {
        return Mono.fromCallable(() -> {
                    PreparedStatement ps = session.prepare(selectName);
                    Row row = session.execute(withQuorum(ps.bind(stationId), quorum)).one();
                    return row == null ? null : row.getString(COL_NAME);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> translateRead(e, quorum));
    }

    @Override
    public Flux<TemperatureReading> readObservations(String stationId, QuorumPolicy quorum) {
        return Flux.defer(() -> {
                    PreparedStatement ps = session.prepare(selectRecords);
                    ResultSet rs = session.execute(withQuorum(ps.bind(stationId), quorum));
                    // Further pages are fetched while iterating, still on this scheduler.
                    return Flux.fromIterable(rs);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .<TemperatureReading>handle((row, sink) -> {
                    TemperatureReading r = toReading(row);
                    if (r != null) {
                        sink.next(r);
                    }
                })
                .onErrorMap(e -> translateRead(e, quorum));
    }

    private BoundStatement withQuorum(BoundStatement stmt, QuorumPolicy quorum) {
        ConsistencyLevel level = CassandraConsistency.forQuorum(quorum, schema.replicationFactor());
        return stmt.setConsistencyLevel(level).setTimeout(requestTimeout);
    }

    private UdtValue toRecord(Observation o) {
        UserDefinedType type = session.getMetadata()
                .getKeyspace(schema.keyspace())
                .flatMap(ks -> ks.getUserDefinedType(schema.recordType().name()))
                .orElseThrow(() -> new ConfigurationException("User type " + schema.keyspace() + "."
                        + schema.recordType().name() + " does not exist"));
        UdtValue v = type.newValue().setInt(FIELD_TMAX, o.tmax());
        if (o.tmin() != null) {
            v = v.setInt(FIELD_TMIN, o.tmin());
        }
        return v;
    }

    /** Null for the static-only row a partition has before its first observation. */
    private static TemperatureReading toReading(Row row) {
        LocalDate date = row.getLocalDate(COL_DATE);
        UdtValue record = row.getUdtValue(COL_RECORD);
        if (date == null || record == null || record.isNull(FIELD_TMAX)) {
            return null;
        }
        Integer tmin = record.isNull(FIELD_TMIN) ? null : record.getInt(FIELD_TMIN);
        return new TemperatureReading(date, tmin, record.getInt(FIELD_TMAX));
    }

    private static Throwable translateWrite(Throwable e, QuorumPolicy quorum) {
        if (isUnavailable(e)) {
            return new WriteUnavailableException("Write quorum " + quorum.requiredAcks() + " not met: " + e.getMessage(),
                    quorum.requiredAcks(), aliveReplicas(e), e);
        }
        if (e instanceof QueryValidationException) {
            return new StoreRejectedException("Write rejected: " + e.getMessage(), e);
        }
        return e;
    }

    private static Throwable translateRead(Throwable e, QuorumPolicy quorum) {
        if (isUnavailable(e)) {
            return new ReadUnavailableException("Read quorum " + quorum.requiredAcks() + " not met: " + e.getMessage(),
                    quorum.requiredAcks(), aliveReplicas(e), e);
        }
        if (e instanceof QueryValidationException) {
            return new StoreRejectedException("Read rejected: " + e.getMessage(), e);
        }
        return e;
    }

    static boolean isUnavailable(Throwable e) {
        return e instanceof UnavailableException
                || e instanceof QueryConsistencyException
                || e instanceof AllNodesFailedException
                || e instanceof DriverTimeoutException
                || e instanceof OverloadedException
                || e instanceof BootstrappingException
                || e instanceof ServerError
                || e instanceof ClosedConnectionException;
    }

    private static int aliveReplicas(Throwable e) {
        return e instanceof UnavailableException u ? u.getAlive() : -1;
    }
}
