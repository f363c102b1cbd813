package org.decentmobility.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("GeometryDistance Tests")
class GeometryDistanceTest {

    @Test
    @DisplayName("Euclidean distance of a 3-4-5 triangle")
    void testEuclidean() {
        assertEquals(5.0d, GeometryDistance.euclideanDistance(0.0d, 0.0d, 3.0d, 4.0d), 1e-12);
    }

    @Test
    @DisplayName("One degree of longitude on the equator is about 111.2 km")
    void testGreatCircleEquator() {
        double meters = GeometryDistance.greatCircleDistanceMeters(0.0d, 0.0d, 0.0d, 1.0d);
        assertEquals(111_195.0d, meters, 5.0d);
    }

    @Test
    @DisplayName("Kilometre variant scales the metre distance")
    void testGreatCircleKilometers() {
        double meters = GeometryDistance.greatCircleDistanceMeters(48.0d, 11.0d, 52.5d, 13.4d);
        assertEquals(meters / 1_000.0d, GeometryDistance.greatCircleDistanceKilometers(48.0d, 11.0d, 52.5d, 13.4d), 1e-9);
    }

    @Test
    @DisplayName("Great-circle distance wraps across the antimeridian")
    void testAntimeridian() {
        double across = GeometryDistance.greatCircleDistanceMeters(0.0d, 179.5d, 0.0d, -179.5d);
        double direct = GeometryDistance.greatCircleDistanceMeters(0.0d, 0.0d, 0.0d, 1.0d);
        assertEquals(direct, across, 1e-6);
    }

    @Test
    @DisplayName("Longitude delta normalizes into (-180, 180]")
    void testNormalizeDeltaLongitude() {
        assertEquals(-1.0d, GeometryDistance.normalizeDeltaLongitudeDegrees(359.0d), 1e-12);
        assertEquals(1.0d, GeometryDistance.normalizeDeltaLongitudeDegrees(-359.0d), 1e-12);
        assertEquals(10.0d, GeometryDistance.normalizeDeltaLongitudeDegrees(10.0d), 1e-12);
        assertEquals(180.0d, GeometryDistance.normalizeDeltaLongitudeDegrees(-180.0d), 1e-12);
    }
}
