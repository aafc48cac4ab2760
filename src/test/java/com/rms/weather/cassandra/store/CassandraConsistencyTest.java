package com.rms.weather.cassandra.store;

import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.quorum.QuorumPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CassandraConsistencyTest {

    @Test
    void mapsReplicaCountsToConsistencyLevels() {
        assertThat(CassandraConsistency.forQuorum(QuorumPolicy.of(1), 3)).isEqualTo(DefaultConsistencyLevel.ONE);
        assertThat(CassandraConsistency.forQuorum(QuorumPolicy.of(2), 3)).isEqualTo(DefaultConsistencyLevel.TWO);
        assertThat(CassandraConsistency.forQuorum(QuorumPolicy.of(3), 3)).isEqualTo(DefaultConsistencyLevel.THREE);
        assertThat(CassandraConsistency.forQuorum(QuorumPolicy.of(5), 5)).isEqualTo(DefaultConsistencyLevel.ALL);
    }

    @Test
    void rejectsCountsWithoutAnExactLevel() {
        assertThatThrownBy(() -> CassandraConsistency.forQuorum(QuorumPolicy.of(4), 5))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CassandraConsistency.forQuorum(QuorumPolicy.of(3), 2))
                .isInstanceOf(ConfigurationException.class);
    }
}
