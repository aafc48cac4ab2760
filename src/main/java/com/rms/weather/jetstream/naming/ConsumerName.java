package com.rms.weather.jetstream.naming;

import java.util.Locale;

/**
 * Durable consumer names.
 *
 * <p>Format: {@code weather_<node>_p<index>}, e.g. {@code weather_node01_p0}.
 * JetStream durable names may not contain '.', '*', '>' or whitespace, so
 * those characters in the node id are replaced with '-'.</p>
 */
public final class ConsumerName {

    private static final String PREFIX = "weather";

    private ConsumerName() {}

    public static String of(String nodeId, int partitionIndex) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if (partitionIndex < 0) {
            throw new IllegalArgumentException("partitionIndex must be >= 0");
        }
        String node = nodeId.trim().toLowerCase(Locale.ROOT).replaceAll("[.*>\\s]", "-");
        return PREFIX + "_" + node + "_p" + partitionIndex;
    }
}
