package at.sv.tide;

import at.sv.tide.tide.TideRegion;

/**
 * The user configurable inputs of the engine.
 *
 * @param latitude  in degrees [-90..90], used for sunrise and sunset
 * @param longitude in degrees [-180..180], used for sunrise and sunset
 * @param stationId the NOAA tide station id
 */
public record FaceSettings(double latitude, double longitude, String stationId) {

    public static final double DEFAULT_LATITUDE = 40.297119;
    public static final double DEFAULT_LONGITUDE = -111.695007;

    public FaceSettings {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be between -90 and 90 degrees: " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be between -180 and 180 degrees: " + longitude);
        }
        if (stationId == null || stationId.isBlank()) {
            throw new IllegalArgumentException("stationId must not be empty");
        }
    }

    public static FaceSettings defaults() {
        return new FaceSettings(DEFAULT_LATITUDE, DEFAULT_LONGITUDE, TideRegion.defaultStation().id());
    }

    public FaceSettings withLocation(double latitude, double longitude) {
        return new FaceSettings(latitude, longitude, stationId);
    }

    public FaceSettings withStationId(String stationId) {
        return new FaceSettings(latitude, longitude, stationId);
    }
}
