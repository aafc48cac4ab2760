package com.rms.weather.store.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Store selection and consistency settings.
 *
 * <p>Configuration prefix: {@code weather.store}</p>
 *
 * <pre>
 * weather:
 *   store:
 *     type: cassandra            # or in-memory
 *     keyspace: weather
 *     replication-factor: 3
 *     write-acks: 1
 *     read-acks: 3               # defaults to replication-factor when unset
 *     request-timeout: 5s
 *     require-read-after-write: true
 * </pre>
 */
@ConfigurationProperties(prefix = "weather.store")
public class StoreProperties {

    public enum StoreType {
        CASSANDRA,
        IN_MEMORY
    }

    /** Which {@code StationStore} implementation to wire. */
    private StoreType type = StoreType.CASSANDRA;

    private String keyspace = "weather";

    /** Replicas holding every partition. */
    private int replicationFactor = 3;

    /** Replicas that must acknowledge an ingestion write. */
    private int writeAcks = 1;

    /** Replicas a query must read from. Null means all replicas. */
    private Integer readAcks;

    /** Upper bound on every single store round trip. */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /**
     * Refuse to start when {@code read-acks + write-acks <= replication-factor},
     * since reads could then miss acknowledged writes.
     */
    private boolean requireReadAfterWrite = true;

    /** In-memory store only: how often queued hints are handed off to live replicas. */
    private Duration hintHandoffInterval = Duration.ofSeconds(1);

    public StoreType getType() { return type; }
    public void setType(StoreType type) { this.type = type; }

    public String getKeyspace() { return keyspace; }
    public void setKeyspace(String keyspace) { this.keyspace = keyspace; }

    public int getReplicationFactor() { return replicationFactor; }
    public void setReplicationFactor(int replicationFactor) { this.replicationFactor = replicationFactor; }

    public int getWriteAcks() { return writeAcks; }
    public void setWriteAcks(int writeAcks) { this.writeAcks = writeAcks; }

    public Integer getReadAcks() { return readAcks; }
    public void setReadAcks(Integer readAcks) { this.readAcks = readAcks; }

    public int effectiveReadAcks() {
        return readAcks == null ? replicationFactor : readAcks;
    }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public boolean isRequireReadAfterWrite() { return requireReadAfterWrite; }
    public void setRequireReadAfterWrite(boolean requireReadAfterWrite) { this.requireReadAfterWrite = requireReadAfterWrite; }

    public Duration getHintHandoffInterval() { return hintHandoffInterval; }
    public void setHintHandoffInterval(Duration hintHandoffInterval) { this.hintHandoffInterval = hintHandoffInterval; }
}
