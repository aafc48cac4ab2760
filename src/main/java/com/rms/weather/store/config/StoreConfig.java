package com.rms.weather.store.config;

import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.quorum.QuorumSettings;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.core.store.StationStore;
import com.rms.weather.store.memory.InMemoryReplicatedStationStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the schema definition, the quorum settings and, for local runs, the
 * in-memory store. The Cassandra store is wired by
 * {@code CassandraSessionConfig}.
 */
@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public StationSchema stationSchema(StoreProperties props) {
        String keyspace = props.getKeyspace();
        if (keyspace == null || !keyspace.matches("[A-Za-z][A-Za-z0-9_]{0,47}")) {
            throw new ConfigurationException("weather.store.keyspace is not a valid keyspace name: " + keyspace);
        }
        return StationSchema.standard(keyspace, props.getReplicationFactor());
    }

    @Bean
    public QuorumSettings quorumSettings(StoreProperties props) {
        QuorumSettings q = buildQuorumSettings(props);
        log.info("Store consistency: {} readAfterWrite={}", q, q.guaranteesReadAfterWrite());
        return q;
    }

    static QuorumSettings buildQuorumSettings(StoreProperties props) {
        QuorumSettings q;
        try {
            q = QuorumSettings.of(props.getReplicationFactor(), props.getWriteAcks(), props.effectiveReadAcks());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid quorum settings: " + e.getMessage(), e);
        }
        if (!q.guaranteesReadAfterWrite()) {
            String msg = "read-acks + write-acks must exceed replication-factor for read-after-write visibility: " + q;
            if (props.isRequireReadAfterWrite()) {
                throw new ConfigurationException(msg);
            }
            log.warn(msg);
        }
        return q;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "weather.store", name = "type", havingValue = "in-memory")
    public StationStore inMemoryStationStore(StoreProperties props) {
        log.info("Using in-memory replicated store (replicas={})", props.getReplicationFactor());
        InMemoryReplicatedStationStore store = new InMemoryReplicatedStationStore(props.getReplicationFactor());
        store.startHintedHandoff(props.getHintHandoffInterval());
        return store;
    }
}
