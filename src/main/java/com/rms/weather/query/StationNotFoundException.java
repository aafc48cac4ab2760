package com.rms.weather.query;

/**
 * A well-formed request for a station that has no data for the requested
 * attribute.
 */
public class StationNotFoundException extends RuntimeException {

    private final String stationId;

    public StationNotFoundException(String stationId, String what) {
        super(what + " not found for station " + stationId);
        this.stationId = stationId;
    }

    public String getStationId() {
        return stationId;
    }
}
