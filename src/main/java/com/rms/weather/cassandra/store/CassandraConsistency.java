package com.rms.weather.cassandra.store;

import com.datastax.oss.driver.api.core.ConsistencyLevel;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.quorum.QuorumPolicy;

/**
 * Maps a replica count to the Cassandra consistency level that waits for
 * exactly that many replicas.
 */
public final class CassandraConsistency {

    private CassandraConsistency() {}

    public static ConsistencyLevel forQuorum(QuorumPolicy quorum, int replicationFactor) {
        int acks = quorum.requiredAcks();
        if (acks > replicationFactor) {
            throw new ConfigurationException("Quorum " + acks + " exceeds replication factor " + replicationFactor);
        }
        return switch (acks) {
            case 1 -> DefaultConsistencyLevel.ONE;
            case 2 -> DefaultConsistencyLevel.TWO;
            case 3 -> DefaultConsistencyLevel.THREE;
            default -> {
                if (acks == replicationFactor) {
                    yield DefaultConsistencyLevel.ALL;
                }
                throw new ConfigurationException("No Cassandra consistency level waits for exactly " + acks
                        + " of " + replicationFactor + " replicas");
            }
        };
    }
}
