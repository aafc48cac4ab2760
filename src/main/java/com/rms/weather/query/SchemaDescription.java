package com.rms.weather.query;

import com.rms.weather.core.schema.ColumnSpec;
import com.rms.weather.core.schema.StationSchema;

import java.util.List;
import java.util.Map;

/**
 * Introspection view of the station table: the layout as structured fields
 * plus the equivalent CQL.
 */
public record SchemaDescription(
        String keyspace,
        String table,
        int replicationFactor,
        String partitionKey,
        String clusteringKey,
        String clusteringOrder,
        List<ColumnSpec> staticColumns,
        List<ColumnSpec> regularColumns,
        Map<String, List<ColumnSpec>> types,
        int writeQuorum,
        int readQuorum,
        String cql
) {

    public static SchemaDescription of(StationSchema schema, int writeQuorum, int readQuorum) {
        return new SchemaDescription(
                schema.keyspace(),
                schema.table(),
                schema.replicationFactor(),
                schema.partitionKey().name(),
                schema.clusteringKey().name(),
                schema.clusteringOrder().name(),
                schema.staticColumns(),
                schema.regularColumns(),
                Map.of(schema.recordType().name(), schema.recordType().fields()),
                writeQuorum,
                readQuorum,
                schema.describeTableCql());
    }
}
