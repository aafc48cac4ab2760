package com.rms.weather.api;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * Body of {@code POST /api/stations/{stationId}/records}. Temperatures in
 * tenths of a degree Celsius; {@code tmin} is optional.
 */
public record RecordTempsRequest(@NotNull LocalDate date, Integer tmin, @NotNull Integer tmax) {
}
