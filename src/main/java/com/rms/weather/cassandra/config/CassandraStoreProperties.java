package com.rms.weather.cassandra.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cassandra connection and schema bootstrap settings.
 *
 * <p>Configuration prefix: {@code weather.cassandra}</p>
 */
@ConfigurationProperties(prefix = "weather.cassandra")
public class CassandraStoreProperties {

    /** {@code host:port} entries; port defaults to 9042. */
    private List<String> contactPoints = new ArrayList<>(List.of("localhost:9042"));

    private String localDatacenter = "datacenter1";

    /** Time allowed for the initial connection to the cluster. */
    private Duration connectTimeout = Duration.ofSeconds(30);

    private Bootstrap bootstrap = new Bootstrap();

    public List<String> getContactPoints() { return contactPoints; }
    public void setContactPoints(List<String> contactPoints) { this.contactPoints = contactPoints; }

    public String getLocalDatacenter() { return localDatacenter; }
    public void setLocalDatacenter(String localDatacenter) { this.localDatacenter = localDatacenter; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Bootstrap getBootstrap() { return bootstrap; }
    public void setBootstrap(Bootstrap bootstrap) { this.bootstrap = bootstrap; }

    public static class Bootstrap {

        /** Create keyspace, type and table at startup when missing. */
        private boolean enabled = true;

        /** Drop the keyspace before creating it. Destroys all stored observations. */
        private boolean dropExisting = false;

        /** Fail startup when an existing keyspace/table differs from the expected layout. */
        private boolean failOnMismatch = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isDropExisting() { return dropExisting; }
        public void setDropExisting(boolean dropExisting) { this.dropExisting = dropExisting; }

        public boolean isFailOnMismatch() { return failOnMismatch; }
        public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }
    }
}
