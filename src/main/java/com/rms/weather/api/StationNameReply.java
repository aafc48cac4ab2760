package com.rms.weather.api;

public record StationNameReply(String name) {
}
