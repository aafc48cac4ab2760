package com.rms.weather.api;

/** Highest recorded tmax, in tenths of a degree Celsius. */
public record StationMaxReply(int tmax) {
}
