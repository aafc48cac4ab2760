package com.rms.weather.core.quorum;

import com.rms.weather.config.ConfigurationException;

/**
 * =====================================================================
 * QuorumSettings
 * =====================================================================
 *
 * The write and read quorums used by this service against a store with a
 * given replication factor (RF).
 *
 * READ-AFTER-WRITE
 * ----------------
 * When {@code R + W > RF}, the replicas touched by a read always overlap the
 * replicas that acknowledged any completed write, so a read issued after the
 * write's acknowledgment observes it.
 *
 * Reference deployment: W = 1 (ingestion keeps going while a majority of
 * replicas is down), R = RF = 3 (reads fail rather than return stale data when
 * any replica is down). 1 + 3 > 3.
 */
public record QuorumSettings(int replicationFactor, QuorumPolicy write, QuorumPolicy read) {

    public QuorumSettings {
        if (replicationFactor < 1) {
            throw new ConfigurationException("replicationFactor must be >= 1 (was " + replicationFactor + ")");
        }
        if (write == null || read == null) {
            throw new ConfigurationException("write and read quorum are required");
        }
        if (write.requiredAcks() > replicationFactor) {
            throw new ConfigurationException("write quorum " + write.requiredAcks()
                    + " exceeds replication factor " + replicationFactor);
        }
        if (read.requiredAcks() > replicationFactor) {
            throw new ConfigurationException("read quorum " + read.requiredAcks()
                    + " exceeds replication factor " + replicationFactor);
        }
    }

    public static QuorumSettings of(int replicationFactor, int writeAcks, int readAcks) {
        return new QuorumSettings(replicationFactor, QuorumPolicy.of(writeAcks), QuorumPolicy.of(readAcks));
    }

    /** W = 1, R = RF. */
    public static QuorumSettings writeOneReadAll(int replicationFactor) {
        return new QuorumSettings(replicationFactor, QuorumPolicy.one(), QuorumPolicy.all(replicationFactor));
    }

    public static boolean overlaps(int writeAcks, int readAcks, int replicationFactor) {
        return writeAcks + readAcks > replicationFactor;
    }

    /** {@code R + W > RF}. */
    public boolean guaranteesReadAfterWrite() {
        return overlaps(write.requiredAcks(), read.requiredAcks(), replicationFactor);
    }

    /**
     * Replica failures a read can tolerate and still meet its quorum:
     * {@code RF - R}.
     */
    public int readFailureTolerance() {
        return replicationFactor - read.requiredAcks();
    }

    /** {@code RF - W}. */
    public int writeFailureTolerance() {
        return replicationFactor - write.requiredAcks();
    }

    @Override
    public String toString() {
        return "QuorumSettings(RF=" + replicationFactor + ", W=" + write.requiredAcks()
                + ", R=" + read.requiredAcks() + ")";
    }
}
