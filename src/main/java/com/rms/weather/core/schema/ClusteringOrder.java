package com.rms.weather.core.schema;

public enum ClusteringOrder {
    ASC,
    DESC
}
