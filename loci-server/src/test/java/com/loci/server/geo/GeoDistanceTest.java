package com.loci.server.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoDistanceTest {

    @Test
    void haversineShouldMatchKnownDistances() {
        // 巴黎 - 伦敦约 343.5 km
        double d = GeoDistance.haversineMeters(48.8566, 2.3522, 51.5074, -0.1278);
        assertEquals(343_500, d, 1_500);
        assertEquals(0.0, GeoDistance.haversineMeters(38.7, -9.1, 38.7, -9.1), 1e-6);
    }

    @Test
    void haversineShouldBeSymmetric() {
        double ab = GeoDistance.haversineMeters(38.7223, -9.1393, 41.1579, -8.6291);
        double ba = GeoDistance.haversineMeters(41.1579, -8.6291, 38.7223, -9.1393);
        assertEquals(ab, ba, 1e-6);
    }

    @Test
    void isValidCoordinateShouldCheckRanges() {
        assertTrue(GeoDistance.isValidCoordinate(90.0, 180.0));
        assertTrue(GeoDistance.isValidCoordinate(-90.0, -180.0));
        assertFalse(GeoDistance.isValidCoordinate(90.1, 0.0));
        assertFalse(GeoDistance.isValidCoordinate(0.0, -180.5));
        assertFalse(GeoDistance.isValidCoordinate(null, 0.0));
        assertFalse(GeoDistance.isValidCoordinate(Double.NaN, 0.0));
    }
}
