package org.decentmobility.geometry;

import lombok.experimental.UtilityClass;

/**
 * Distance formulas behind the built-in location strategies.
 *
 * <p>Grid distances are in grid units; geographic distances use the haversine form on a
 * spherical earth of mean radius {@value #EARTH_MEAN_RADIUS_METERS} m.</p>
 */
@UtilityClass
public final class GeometryDistance {
    static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;
    private static final double METERS_PER_KILOMETER = 1_000.0d;

    /**
     * Straight-line distance between two grid points.
     */
    public static double euclideanDistance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    /**
     * Great-circle distance between two WGS84 points [metre].
     */
    public static double greatCircleDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double phi1 = Math.toRadians(lat1Deg);
        double phi2 = Math.toRadians(lat2Deg);
        double halfDeltaPhi = Math.toRadians(lat2Deg - lat1Deg) / 2.0d;
        double halfDeltaLambda = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg)) / 2.0d;

        double haversine = square(Math.sin(halfDeltaPhi))
                + Math.cos(phi1) * Math.cos(phi2) * square(Math.sin(halfDeltaLambda));
        // rounding can push the haversine slightly outside [0, 1]
        haversine = Math.min(1.0d, Math.max(0.0d, haversine));
        return 2.0d * EARTH_MEAN_RADIUS_METERS * Math.asin(Math.sqrt(haversine));
    }

    /**
     * Great-circle distance between two WGS84 points [kilometre].
     */
    public static double greatCircleDistanceKilometers(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        return greatCircleDistanceMeters(lat1Deg, lon1Deg, lat2Deg, lon2Deg) / METERS_PER_KILOMETER;
    }

    /**
     * Maps a longitude difference onto {@code (-180, 180]} so paths cross the antimeridian.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double wrapped = (deltaLonDeg % 360.0d + 360.0d) % 360.0d;
        return wrapped > 180.0d ? wrapped - 360.0d : wrapped;
    }

    private static double square(double value) {
        return value * value;
    }
}
