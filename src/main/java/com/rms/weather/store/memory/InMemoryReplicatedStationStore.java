package com.rms.weather.store.memory;

import com.rms.weather.core.model.Observation;
import com.rms.weather.core.model.TemperatureReading;
import com.rms.weather.core.quorum.QuorumPolicy;
import com.rms.weather.core.store.ReadUnavailableException;
import com.rms.weather.core.store.StationStore;
import com.rms.weather.core.store.WriteUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * =====================================================================
 * InMemoryReplicatedStationStore
 * =====================================================================
 *
 * A replicated {@link StationStore} held in memory, with replicas that can be
 * taken down and brought back. Used for local runs without Cassandra and for
 * exercising quorum behaviour in tests.
 *
 * REPLICATION MODEL
 * -----------------
 * Every replica owns a full copy of every partition (a single replica set of
 * size RF).
 *
 * Writes:
 *  - fail with {@link WriteUnavailableException} if fewer than W replicas are up
 *  - are applied to the first W live replicas (in index order) and nothing else
 *  - are queued as hints for every other replica
 *
 * This is the slowest replication a real store is allowed to exhibit: after
 * the acknowledgment only W replicas are guaranteed to hold the write.
 *
 * Reads:
 *  - fail with {@link ReadUnavailableException} if fewer than R replicas are up
 *  - gather R live replicas starting from the highest index, i.e. the replicas
 *    least likely to hold a recent write
 *  - reconcile cell by cell, newest write timestamp wins
 *
 * With those two choices a read observes a completed write exactly when the
 * replica sets must intersect, which is {@code R + W > RF}.
 *
 * HINTED HANDOFF
 * --------------
 * Hints for a replica are replayed when it is marked up, and for every live
 * replica by {@link #deliverHints()}. {@link #startHintedHandoff(Duration)}
 * runs that on a fixed interval until {@link #close()}; without it hints stay
 * queued, which tests use to observe the slowest legal replication.
 *
 * CONFLICTS
 * ---------
 * Every write gets a strictly increasing timestamp. The temperature record of
 * (station, date) and the station's static name are separate cells, each
 * resolved last-write-wins.
 */
public class InMemoryReplicatedStationStore implements StationStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReplicatedStationStore.class);

    private final List<Replica> replicas;
    private final AtomicLong lastTimestamp = new AtomicLong();
    private Disposable handoff;

    public InMemoryReplicatedStationStore(int replicationFactor) {
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("replicationFactor must be >= 1");
        }
        List<Replica> r = new ArrayList<>(replicationFactor);
        for (int i = 0; i < replicationFactor; i++) {
            r.add(new Replica(i));
        }
        this.replicas = Collections.unmodifiableList(r);
    }

    // ---------------------------------------------------------------------
    // StationStore
    // ---------------------------------------------------------------------

    @Override
    public Mono<Void> upsert(Observation observation, QuorumPolicy quorum) {
        return Mono.fromRunnable(() -> write(observation, quorum));
    }

    @Override
    public Mono<String> readName(String stationId, QuorumPolicy quorum) {
        return Mono.fromCallable(() -> reconcileName(stationId, quorum));
    }

    @Override
    public Flux<TemperatureReading> readObservations(String stationId, QuorumPolicy quorum) {
        return Flux.defer(() -> Flux.fromIterable(reconcileRows(stationId, quorum)));
    }

    // ---------------------------------------------------------------------
    // Replica control
    // ---------------------------------------------------------------------

    public int replicationFactor() {
        return replicas.size();
    }

    public synchronized void markDown(int replica) {
        replicas.get(replica).up = false;
        log.info("Replica {} marked down ({} of {} alive)", replica, aliveCount(), replicas.size());
    }

    /** Brings the replica back and replays the hints queued for it. */
    public synchronized void markUp(int replica) {
        Replica r = replicas.get(replica);
        r.up = true;
        int replayed = r.replayHints();
        log.info("Replica {} marked up ({} of {} alive, {} hints replayed)", replica, aliveCount(), replicas.size(),
                replayed);
    }

    public synchronized boolean isUp(int replica) {
        return replicas.get(replica).up;
    }

    public synchronized int aliveCount() {
        return alive().size();
    }

    /**
     * Applies queued writes to every live replica.
     *
     * @return number of mutations applied
     */
    public synchronized int deliverHints() {
        int delivered = 0;
        for (Replica r : replicas) {
            if (r.up) {
                delivered += r.replayHints();
            }
        }
        if (delivered > 0) {
            log.debug("Delivered {} hinted mutations", delivered);
        }
        return delivered;
    }

    /** Hints queued and not yet replayed, over all replicas. */
    public synchronized int pendingHints() {
        int pending = 0;
        for (Replica r : replicas) {
            pending += r.hints.size();
        }
        return pending;
    }

    /** Delivers hints every {@code interval} until {@link #close()}. Idempotent. */
    public synchronized void startHintedHandoff(Duration interval) {
        if (handoff != null && !handoff.isDisposed()) {
            return;
        }
        handoff = Flux.interval(interval, Schedulers.single())
                .onBackpressureDrop()
                .subscribe(
                        tick -> deliverHints(),
                        err -> log.error("Hinted handoff stopped: {}", err.toString(), err));
        log.info("Hinted handoff every {}", interval);
    }

    @Override
    public synchronized void close() {
        if (handoff != null) {
            handoff.dispose();
            handoff = null;
        }
    }

    /** Whether the given replica holds a row for (station, date). */
    public synchronized boolean holds(int replica, String stationId, LocalDate date) {
        Partition p = replicas.get(replica).partitions.get(stationId);
        return p != null && p.rows.containsKey(date);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private synchronized void write(Observation o, QuorumPolicy quorum) {
        int alive = aliveCount();
        if (!quorum.isSatisfiedBy(alive)) {
            throw new WriteUnavailableException(
                    "Cannot achieve write quorum " + quorum.requiredAcks() + ": " + alive + " of "
                            + replicas.size() + " replicas alive",
                    quorum.requiredAcks(), alive);
        }

        Mutation m = new Mutation(o, nextTimestamp());
        int acked = 0;
        for (Replica r : replicas) {
            if (r.up && acked < quorum.requiredAcks()) {
                r.apply(m);
                acked++;
            } else {
                r.hints.add(m);
            }
        }
        log.debug("Applied station={} date={} ts={} to {} replica(s)", o.stationId(), o.date(), m.timestamp, acked);
    }

    private synchronized String reconcileName(String stationId, QuorumPolicy quorum) {
        Cell<String> newest = null;
        for (Replica r : readTargets(quorum)) {
            Partition p = r.partitions.get(stationId);
            if (p == null || p.name == null) {
                continue;
            }
            if (newest == null || p.name.timestamp > newest.timestamp) {
                newest = p.name;
            }
        }
        return newest == null ? null : newest.value;
    }

    private synchronized List<TemperatureReading> reconcileRows(String stationId, QuorumPolicy quorum) {
        TreeMap<LocalDate, Cell<TemperatureReading>> merged = new TreeMap<>();
        for (Replica r : readTargets(quorum)) {
            Partition p = r.partitions.get(stationId);
            if (p == null) {
                continue;
            }
            for (Map.Entry<LocalDate, Cell<TemperatureReading>> e : p.rows.entrySet()) {
                merged.merge(e.getKey(), e.getValue(), (a, b) -> b.timestamp > a.timestamp ? b : a);
            }
        }
        List<TemperatureReading> out = new ArrayList<>(merged.size());
        for (Cell<TemperatureReading> c : merged.values()) {
            out.add(c.value);
        }
        return out;
    }

    private List<Replica> readTargets(QuorumPolicy quorum) {
        List<Replica> alive = alive();
        if (!quorum.isSatisfiedBy(alive.size())) {
            throw new ReadUnavailableException(
                    "Cannot achieve read quorum " + quorum.requiredAcks() + ": " + alive.size() + " of "
                            + replicas.size() + " replicas alive",
                    quorum.requiredAcks(), alive.size());
        }
        Collections.reverse(alive);
        return alive.subList(0, quorum.requiredAcks());
    }

    private List<Replica> alive() {
        List<Replica> out = new ArrayList<>(replicas.size());
        for (Replica r : replicas) {
            if (r.up) {
                out.add(r);
            }
        }
        return out;
    }

    private long nextTimestamp() {
        long nowMicros = System.currentTimeMillis() * 1000L;
        return lastTimestamp.updateAndGet(prev -> Math.max(prev + 1, nowMicros));
    }

    private static final class Replica {
        final int index;
        boolean up = true;
        final Map<String, Partition> partitions = new HashMap<>();
        final List<Mutation> hints = new ArrayList<>();

        Replica(int index) {
            this.index = index;
        }

        int replayHints() {
            int n = hints.size();
            for (Mutation m : hints) {
                apply(m);
            }
            hints.clear();
            return n;
        }

        void apply(Mutation m) {
            Observation o = m.observation;
            Partition p = partitions.computeIfAbsent(o.stationId(), k -> new Partition());
            p.rows.merge(o.date(), new Cell<>(o.reading(), m.timestamp),
                    (existing, incoming) -> incoming.timestamp > existing.timestamp ? incoming : existing);
            if (o.hasName() && (p.name == null || m.timestamp > p.name.timestamp)) {
                p.name = new Cell<>(o.name(), m.timestamp);
            }
        }

        @Override
        public String toString() {
            return "Replica[" + index + (up ? ",up" : ",down") + "]";
        }
    }

    private static final class Partition {
        Cell<String> name;
        final TreeMap<LocalDate, Cell<TemperatureReading>> rows = new TreeMap<>();
    }

    private record Cell<T>(T value, long timestamp) {
    }

    private record Mutation(Observation observation, long timestamp) {
    }
}
