package com.rms.weather.core.model;

import java.time.LocalDate;

/**
 * One row of a station partition as returned by a read: the clustering key and
 * the stored temperature record.
 */
public record TemperatureReading(LocalDate date, Integer tmin, int tmax) {
}
