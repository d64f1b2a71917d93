package org.depotroute.routing.distance;

import org.depotroute.core.error.InsufficientDataException;
import org.depotroute.core.error.ValidationException;
import org.depotroute.core.geo.GeoDistance;
import org.depotroute.core.id.LocationIdMapper;
import org.depotroute.routing.model.Location;
import org.depotroute.testutil.LocationFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistanceMatrixBuilderTest {

    @Test
    @DisplayName("Matrix: zero diagonal, exact symmetry and haversine cells")
    void testMatrixShape() {
        List<Location> locations = LocationFixtures.randomSquare(12, 7L);
        DistanceMatrix matrix = DistanceMatrixBuilder.build(locations);

        assertEquals(13, matrix.size());
        for (int i = 0; i < matrix.size(); i++) {
            assertEquals(0.0d, matrix.distanceAt(i, i));
            for (int j = 0; j < matrix.size(); j++) {
                assertEquals(matrix.distanceAt(i, j), matrix.distanceAt(j, i));
                assertTrue(matrix.distanceAt(i, j) >= 0.0d);
            }
        }

        Location a = locations.get(3);
        Location b = locations.get(9);
        double expected = GeoDistance.haversineKm(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
        assertEquals(expected, matrix.distanceKm(a.getId(), b.getId()), 1e-12);
    }

    @Test
    @DisplayName("Lookup: ids follow supplied order, including sparse ids")
    void testSparseIds() {
        List<Location> locations = List.of(
                LocationFixtures.location(100, 0.0, 0.0, true),
                LocationFixtures.stop(7, 0.0, 1.0),
                LocationFixtures.stop(55, 1.0, 0.0)
        );
        DistanceMatrix matrix = DistanceMatrixBuilder.build(locations);

        assertArrayEquals(new int[]{100, 7, 55}, matrix.locationIds());
        assertEquals(1, matrix.indexOf(7));
        assertEquals(55, matrix.locationIdAt(2));
        assertTrue(matrix.containsLocation(100));
        assertFalse(matrix.containsLocation(1));
        assertEquals(111.1949, matrix.distanceKm(100, 7), 1e-3);
        assertThrows(LocationIdMapper.UnknownLocationException.class, () -> matrix.distanceKm(100, 1));
    }

    @Test
    @DisplayName("Edge: coincident points have zero distance")
    void testCoincidentPoints() {
        DistanceMatrix matrix = DistanceMatrixBuilder.build(List.of(
                LocationFixtures.depot(17.0, 78.0),
                LocationFixtures.stop(1, 17.0, 78.0)
        ));
        assertEquals(0.0d, matrix.distanceKm(0, 1));
    }

    @Test
    @DisplayName("Validation: fewer than two locations")
    void testTooFewLocations() {
        InsufficientDataException ex = assertThrows(
                InsufficientDataException.class,
                () -> DistanceMatrixBuilder.build(List.of(LocationFixtures.depot(0.0, 0.0)))
        );
        assertEquals(InsufficientDataException.REASON_TOO_FEW_LOCATIONS, ex.getReasonCode());
    }

    @Test
    @DisplayName("Validation: duplicate ids and bad coordinates")
    void testInvalidLocations() {
        ValidationException duplicate = assertThrows(ValidationException.class, () -> DistanceMatrixBuilder.build(List.of(
                LocationFixtures.depot(0.0, 0.0),
                LocationFixtures.stop(0, 1.0, 1.0)
        )));
        assertEquals(ValidationException.REASON_DUPLICATE_LOCATION_ID, duplicate.getReasonCode());

        ValidationException latitude = assertThrows(ValidationException.class, () -> DistanceMatrixBuilder.build(List.of(
                LocationFixtures.depot(0.0, 0.0),
                LocationFixtures.stop(1, 95.0, 1.0)
        )));
        assertEquals(ValidationException.REASON_LATITUDE_OUT_OF_RANGE, latitude.getReasonCode());
    }
}
