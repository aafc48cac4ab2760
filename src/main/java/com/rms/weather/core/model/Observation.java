package com.rms.weather.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * =====================================================================
 * Observation
 * =====================================================================
 *
 * One validated daily observation for a station.
 *
 * KEY
 * ---
 * (stationId, date) is the primary key of the stored row:
 *  - stationId is the partition key (all of a station's days live together)
 *  - date is the clustering key (rows are ordered ascending by date)
 *
 * A second write with the same key replaces the stored temperatures; it never
 * creates a second row.
 *
 * NAME
 * ----
 * {@code name} is optional. When present it is written to the partition's
 * static column, shared by every row of the station.
 *
 * TEMPERATURES
 * ------------
 * Integers in tenths of a degree Celsius. {@code tmax} is required,
 * {@code tmin} may be null.
 */
public record Observation(
        String stationId,
        LocalDate date,
        String name,
        Integer tmin,
        int tmax
) {

    public Observation {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(date, "date");
        if (stationId.isBlank()) {
            throw new IllegalArgumentException("stationId must not be blank");
        }
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public TemperatureReading reading() {
        return new TemperatureReading(date, tmin, tmax);
    }
}
