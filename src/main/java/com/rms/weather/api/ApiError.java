package com.rms.weather.api;

/** Error body of every failed API call. */
public record ApiError(String code, String message) {
}
