package com.rms.weather.cassandra.bootstrap;

import com.datastax.oss.driver.api.core.CqlIdentifier;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.metadata.schema.ColumnMetadata;
import com.datastax.oss.driver.api.core.metadata.schema.KeyspaceMetadata;
import com.datastax.oss.driver.api.core.metadata.schema.TableMetadata;
import com.rms.weather.cassandra.config.CassandraStoreProperties;
import com.rms.weather.config.ConfigurationException;
import com.rms.weather.core.schema.ColumnSpec;
import com.rms.weather.core.schema.StationSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * CassandraSchemaBootstrapper
 * =====================================================================
 *
 * Startup-time schema provisioning for the station table.
 *
 * RESPONSIBILITIES
 * ----------------
 *  - Optionally drop the keyspace (weather.cassandra.bootstrap.drop-existing)
 *  - Create keyspace, record type and table when missing
 *  - Validate an existing keyspace/table against {@link StationSchema}
 *
 * Registered by {@code CassandraSessionConfig} when
 * weather.cassandra.bootstrap.enabled is true (default).
 *
 * Runs as an {@link ApplicationRunner}, i.e. before ApplicationReadyEvent, so
 * the stream consumer never writes into a table that does not exist yet.
 *
 * MISMATCH HANDLING
 * -----------------
 * weather.cassandra.bootstrap.fail-on-mismatch=true  -> startup fails
 * weather.cassandra.bootstrap.fail-on-mismatch=false -> warning only
 *
 * Existing tables are never altered.
 */
public class CassandraSchemaBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CassandraSchemaBootstrapper.class);

    private final CqlSession session;
    private final StationSchema schema;
    private final CassandraStoreProperties props;

    public CassandraSchemaBootstrapper(CqlSession session, StationSchema schema, CassandraStoreProperties props) {
        this.session = session;
        this.schema = schema;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        CassandraStoreProperties.Bootstrap bootstrap = props.getBootstrap();

        if (bootstrap.isDropExisting()) {
            log.warn("Dropping keyspace {} before bootstrap (drop-existing=true)", schema.keyspace());
            ddl(schema.dropKeyspaceCql());
        }

        ddl(schema.createKeyspaceCql());
        ddl(schema.createTypeCql());
        ddl(schema.createTableCql());

        if (!session.checkSchemaAgreement()) {
            log.warn("Cassandra schema agreement not reached after bootstrap of {}", schema.qualifiedTable());
        }
        session.refreshSchema();

        List<String> diffs = validate();
        if (diffs.isEmpty()) {
            log.info("Cassandra schema ready: {} (rf={}, clustering={} {})",
                    schema.qualifiedTable(), schema.replicationFactor(),
                    schema.clusteringKey().name(), schema.clusteringOrder());
            return;
        }

        String msg = "Cassandra schema exists but differs from expected: " + schema.qualifiedTable()
                + " :: " + String.join("; ", diffs);
        if (bootstrap.isFailOnMismatch()) {
            throw new ConfigurationException(msg);
        }
        log.warn(msg);
    }

    List<String> validate() {
        List<String> diffs = new ArrayList<>();

        KeyspaceMetadata ks = session.getMetadata().getKeyspace(schema.keyspace()).orElse(null);
        if (ks == null) {
            diffs.add("keyspace " + schema.keyspace() + " missing");
            return diffs;
        }

        String rf = ks.getReplication().get("replication_factor");
        if (rf != null && !rf.equals(String.valueOf(schema.replicationFactor()))) {
            diffs.add("replication_factor actual=" + rf + " expected=" + schema.replicationFactor());
        }

        if (ks.getUserDefinedType(schema.recordType().name()).isEmpty()) {
            diffs.add("type " + schema.recordType().name() + " missing");
        }

        TableMetadata table = ks.getTable(schema.table()).orElse(null);
        if (table == null) {
            diffs.add("table " + schema.table() + " missing");
            return diffs;
        }

        List<String> partitionKey = new ArrayList<>();
        for (ColumnMetadata c : table.getPartitionKey()) {
            partitionKey.add(c.getName().asInternal());
        }
        if (!partitionKey.equals(List.of(schema.partitionKey().name()))) {
            diffs.add("partitionKey actual=" + partitionKey + " expected=[" + schema.partitionKey().name() + "]");
        }

        List<String> clustering = new ArrayList<>();
        for (Map.Entry<ColumnMetadata, com.datastax.oss.driver.api.core.metadata.schema.ClusteringOrder> e
                : table.getClusteringColumns().entrySet()) {
            clustering.add(e.getKey().getName().asInternal() + " " + e.getValue().name());
        }
        String expectedClustering = schema.clusteringKey().name() + " " + schema.clusteringOrder().name();
        if (!clustering.equals(List.of(expectedClustering))) {
            diffs.add("clustering actual=" + clustering + " expected=[" + expectedClustering + "]");
        }

        for (ColumnSpec c : schema.staticColumns()) {
            ColumnMetadata actual = table.getColumn(CqlIdentifier.fromInternal(c.name())).orElse(null);
            if (actual == null || !actual.isStatic()) {
                diffs.add("static column " + c.name() + " missing");
            }
        }
        for (ColumnSpec c : schema.regularColumns()) {
            if (table.getColumn(CqlIdentifier.fromInternal(c.name())).isEmpty()) {
                diffs.add("column " + c.name() + " missing");
            }
        }
        return diffs;
    }

    private void ddl(String cql) {
        Duration timeout = props.getConnectTimeout();
        log.debug("Executing DDL: {}", cql);
        session.execute(SimpleStatement.newInstance(cql).setTimeout(timeout));
    }
}
