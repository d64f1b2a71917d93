package org.depotroute.core.geo;

import org.depotroute.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GeoDistanceTest {

    @Test
    @DisplayName("Haversine: identical points are zero kilometers apart")
    void testIdenticalPoints() {
        assertEquals(0.0d, GeoDistance.haversineKm(17.4485, 78.3908, 17.4485, 78.3908), 1e-12);
    }

    @Test
    @DisplayName("Haversine: one degree of longitude on the equator")
    void testOneDegreeOnEquator() {
        assertEquals(111.1949, GeoDistance.haversineKm(0.0, 0.0, 0.0, 1.0), 1e-3);
    }

    @Test
    @DisplayName("Haversine: Hyderabad warehouse to Madhapur")
    void testKnownCityPair() {
        assertEquals(1.3972, GeoDistance.haversineKm(17.4485, 78.3908, 17.4400, 78.3811), 1e-3);
    }

    @Test
    @DisplayName("Haversine: symmetric and finite for antipodal points")
    void testSymmetryAndAntipodes() {
        double forward = GeoDistance.haversineKm(12.0, -45.0, -33.5, 151.2);
        double backward = GeoDistance.haversineKm(-33.5, 151.2, 12.0, -45.0);
        assertEquals(forward, backward, 1e-9);
        assertEquals(Math.PI * GeoDistance.EARTH_RADIUS_KM, GeoDistance.haversineKm(0.0, 0.0, 0.0, 180.0), 1e-6);
    }

    @Test
    @DisplayName("Validation: out-of-range latitude and longitude are rejected")
    void testInvalidCoordinates() {
        ValidationException lat = assertThrows(
                ValidationException.class,
                () -> GeoDistance.haversineKm(91.0, 0.0, 0.0, 0.0)
        );
        assertEquals(ValidationException.REASON_LATITUDE_OUT_OF_RANGE, lat.getReasonCode());

        ValidationException lon = assertThrows(
                ValidationException.class,
                () -> GeoDistance.haversineKm(0.0, 0.0, 0.0, -180.5)
        );
        assertEquals(ValidationException.REASON_LONGITUDE_OUT_OF_RANGE, lon.getReasonCode());

        assertThrows(ValidationException.class, () -> GeoDistance.requireValidCoordinate(Double.NaN, 0.0));
    }

    @Test
    @DisplayName("Euclidean: squared distance in degree space")
    void testSquaredEuclidean() {
        assertEquals(25.0d, GeoDistance.squaredEuclidean(0.0, 0.0, 3.0, 4.0), 1e-12);
    }
}
