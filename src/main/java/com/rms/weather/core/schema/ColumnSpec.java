package com.rms.weather.core.schema;

/**
 * A column (or user-type field) by name and CQL type.
 */
public record ColumnSpec(String name, String type) {

    public String toCql() {
        return name + " " + type;
    }
}
