package org.decentmobility.model;

import lombok.Value;
import org.decentmobility.geometry.GeometryDistance;

import java.util.Objects;

/**
 * Location denoted by WGS84 latitude/longitude degrees.
 */
@Value
public class GeoLocation implements Location {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    double latitude;
    double longitude;

    public GeoLocation(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException("LAT_LON coordinates must be finite");
        }
        if (latitude < MIN_LAT || latitude > MAX_LAT || longitude < MIN_LON || longitude > MAX_LON) {
            throw new IllegalArgumentException("LAT_LON coordinates must be in [-90,90] and [-180,180]");
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Creates a geographic location.
     */
    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude);
    }

    /**
     * Returns the great-circle distance in meters to another geographic location.
     */
    public double distanceTo(GeoLocation other) {
        GeoLocation nonNull = Objects.requireNonNull(other, "other");
        return GeometryDistance.greatCircleDistanceMeters(latitude, longitude, nonNull.latitude, nonNull.longitude);
    }
}
