package com.rms.weather.cassandra.config;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.rms.weather.cassandra.bootstrap.CassandraSchemaBootstrapper;
import com.rms.weather.cassandra.store.CassandraStationStore;
import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.schema.StationSchema;
import com.rms.weather.core.store.StationStore;
import com.rms.weather.store.config.StoreProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the process-wide {@link CqlSession} (the driver's connection pool)
 * and the Cassandra-backed {@link StationStore}.
 *
 * <p>The session is opened at startup, shared by the stream consumer and the
 * query service, and closed with the application context.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "weather.store", name = "type", havingValue = "cassandra", matchIfMissing = true)
@EnableConfigurationProperties(CassandraStoreProperties.class)
public class CassandraSessionConfig {

    private static final Logger log = LoggerFactory.getLogger(CassandraSessionConfig.class);

    private static final int DEFAULT_PORT = 9042;

    @Bean(destroyMethod = "close")
    public CqlSession cqlSession(CassandraStoreProperties props, StoreProperties storeProps) {
        List<InetSocketAddress> contactPoints = parseContactPoints(props.getContactPoints());

        DriverConfigLoader loader = DriverConfigLoader.programmaticBuilder()
                .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, storeProps.getRequestTimeout())
                .withDuration(DefaultDriverOption.CONNECTION_INIT_QUERY_TIMEOUT, props.getConnectTimeout())
                .withDuration(DefaultDriverOption.CONTROL_CONNECTION_TIMEOUT, props.getConnectTimeout())
                .build();

        CqlSessionBuilder builder = CqlSession.builder()
                .addContactPoints(contactPoints)
                .withLocalDatacenter(props.getLocalDatacenter())
                .withConfigLoader(loader);

        CqlSession session = builder.build();
        log.info("Connected to Cassandra (contactPoints={}, datacenter={}, requestTimeout={})",
                props.getContactPoints(), props.getLocalDatacenter(), storeProps.getRequestTimeout());
        return session;
    }

    @Bean
    public StationStore cassandraStationStore(CqlSession session, StationSchema schema, StoreProperties storeProps) {
        return new CassandraStationStore(session, schema, storeProps.getRequestTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "weather.cassandra.bootstrap", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public CassandraSchemaBootstrapper cassandraSchemaBootstrapper(CqlSession session, StationSchema schema,
                                                                   CassandraStoreProperties props) {
        return new CassandraSchemaBootstrapper(session, schema, props);
    }

    static List<InetSocketAddress> parseContactPoints(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new ConfigurationException("weather.cassandra.contact-points must not be empty");
        }
        List<InetSocketAddress> out = new ArrayList<>(raw.size());
        for (String entry : raw) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String v = entry.trim();
            int colon = v.lastIndexOf(':');
            String host = colon < 0 ? v : v.substring(0, colon);
            int port = DEFAULT_PORT;
            if (colon >= 0) {
                try {
                    port = Integer.parseInt(v.substring(colon + 1));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("Invalid contact point port: " + entry, e);
                }
            }
            out.add(new InetSocketAddress(host, port));
        }
        if (out.isEmpty()) {
            throw new ConfigurationException("weather.cassandra.contact-points must not be empty");
        }
        return out;
    }
}
