package com.rms.weather.core.schema;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * =====================================================================
 * StationSchema
 * =====================================================================
 *
 * The logical definition of the {@code stations} table, held as data.
 *
 * LAYOUT
 * ------
 *  - partition key  : id text           (one partition per station)
 *  - clustering key : date date ASC     (rows ordered by day inside it)
 *  - static column  : name text         (one value per partition)
 *  - regular column : record station_record { tmin int, tmax int }
 *
 * Built once at startup and never mutated. The schema bootstrapper creates and
 * validates the store from it, and the query surface returns it for
 * introspection, so the layout is written down in exactly one place.
 */
public record StationSchema(
        String keyspace,
        String table,
        int replicationFactor,
        ColumnSpec partitionKey,
        ColumnSpec clusteringKey,
        ClusteringOrder clusteringOrder,
        List<ColumnSpec> staticColumns,
        List<ColumnSpec> regularColumns,
        UserType recordType
) {

    public static final String TABLE = "stations";
    public static final String COL_ID = "id";
    public static final String COL_DATE = "date";
    public static final String COL_NAME = "name";
    public static final String COL_RECORD = "record";
    public static final String RECORD_TYPE = "station_record";
    public static final String FIELD_TMIN = "tmin";
    public static final String FIELD_TMAX = "tmax";

    public StationSchema {
        Objects.requireNonNull(keyspace, "keyspace");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(clusteringKey, "clusteringKey");
        Objects.requireNonNull(clusteringOrder, "clusteringOrder");
        Objects.requireNonNull(recordType, "recordType");
        staticColumns = List.copyOf(staticColumns);
        regularColumns = List.copyOf(regularColumns);
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("replicationFactor must be >= 1");
        }
    }

    /** The fixed station layout in the given keyspace. */
    public static StationSchema standard(String keyspace, int replicationFactor) {
        return new StationSchema(
                keyspace,
                TABLE,
                replicationFactor,
                new ColumnSpec(COL_ID, "text"),
                new ColumnSpec(COL_DATE, "date"),
                ClusteringOrder.ASC,
                List.of(new ColumnSpec(COL_NAME, "text")),
                List.of(new ColumnSpec(COL_RECORD, RECORD_TYPE)),
                new UserType(RECORD_TYPE, List.of(
                        new ColumnSpec(FIELD_TMIN, "int"),
                        new ColumnSpec(FIELD_TMAX, "int"))));
    }

    public String qualifiedTable() {
        return keyspace + "." + table;
    }

    public String createKeyspaceCql() {
        return "CREATE KEYSPACE IF NOT EXISTS " + keyspace
                + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': " + replicationFactor + "}";
    }

    public String dropKeyspaceCql() {
        return "DROP KEYSPACE IF EXISTS " + keyspace;
    }

    public String createTypeCql() {
        return "CREATE TYPE IF NOT EXISTS " + keyspace + "." + recordType.name() + " ("
                + recordType.fields().stream().map(ColumnSpec::toCql).collect(Collectors.joining(", "))
                + ")";
    }

    public String createTableCql() {
        return tableCql(true);
    }

    /** The table definition as a plain {@code CREATE TABLE} statement. */
    public String describeTableCql() {
        return tableCql(false);
    }

    private String tableCql(boolean ifNotExists) {
        StringBuilder sb = new StringBuilder("CREATE TABLE ");
        if (ifNotExists) {
            sb.append("IF NOT EXISTS ");
        }
        sb.append(qualifiedTable()).append(" (\n");
        sb.append("    ").append(partitionKey.toCql()).append(",\n");
        sb.append("    ").append(clusteringKey.toCql()).append(",\n");
        for (ColumnSpec c : staticColumns) {
            sb.append("    ").append(c.toCql()).append(" static,\n");
        }
        for (ColumnSpec c : regularColumns) {
            sb.append("    ").append(c.toCql()).append(",\n");
        }
        sb.append("    PRIMARY KEY (").append(partitionKey.name()).append(", ").append(clusteringKey.name()).append(")\n");
        sb.append(") WITH CLUSTERING ORDER BY (").append(clusteringKey.name()).append(' ')
                .append(clusteringOrder.name()).append(')');
        return sb.toString();
    }

    /** A CQL user-defined type. */
    public record UserType(String name, List<ColumnSpec> fields) {
        public UserType {
            fields = List.copyOf(fields);
        }
    }
}
