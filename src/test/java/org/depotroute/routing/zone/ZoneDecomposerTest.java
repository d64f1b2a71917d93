package org.depotroute.routing.zone;

import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.InsufficientDataException;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.core.error.ValidationException;
import org.depotroute.routing.model.Location;
import org.depotroute.routing.model.Zone;
import org.depotroute.testutil.LocationFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZoneDecomposerTest {

    private static List<Location> twoClusters() {
        return List.of(
                LocationFixtures.depot(0.0, 0.0),
                LocationFixtures.stop(1, 0.0, 0.01),
                LocationFixtures.stop(2, 0.0, 0.02),
                LocationFixtures.stop(3, 0.0, 0.03),
                LocationFixtures.stop(4, 1.0, 1.00),
                LocationFixtures.stop(5, 1.0, 1.01),
                LocationFixtures.stop(6, 1.0, 1.02)
        );
    }

    @Test
    @DisplayName("Clustering: two separated groups split into two zones")
    void testTwoClusters() {
        ZoneDecomposition result = new ZoneDecomposer().decompose(twoClusters(), 2, 42L, SolveBudget.of(100));

        assertTrue(result.converged());
        assertNull(result.getWarning());
        assertEquals(List.of(1, 2, 3), result.getZones().get(0).getMemberIds());
        assertEquals(List.of(4, 5, 6), result.getZones().get(1).getMemberIds());
        assertEquals(0.0d, result.getZones().get(0).getCentroid().getLatitude(), 1e-12);
        assertEquals(0.02d, result.getZones().get(0).getCentroid().getLongitude(), 1e-12);
        assertEquals(1.01d, result.getZones().get(1).getCentroid().getLongitude(), 1e-12);
    }

    @Test
    @DisplayName("Clustering: k=1 puts every stop in zone 0")
    void testSingleZone() {
        ZoneDecomposition result = new ZoneDecomposer().decompose(twoClusters(), 1, 42L, SolveBudget.of(100));
        assertEquals(1, result.getZones().size());
        assertEquals(List.of(1, 2, 3, 4, 5, 6), result.getZones().get(0).getMemberIds());
        assertEquals(0, result.getZones().get(0).getZoneId());
    }

    @ParameterizedTest
    @EnumSource(SeedingStrategy.class)
    @DisplayName("Partition: every stop lands in exactly one zone, depot in none")
    void testPartitionProperty(SeedingStrategy seeding) {
        List<Location> locations = LocationFixtures.randomSquare(60, 11L);
        ZoneDecomposition result = new ZoneDecomposer(seeding, EmptyZonePolicy.RESEED_FARTHEST)
                .decompose(locations, 5, 9L, SolveBudget.of(100));

        assertEquals(5, result.getZones().size());
        Set<Integer> seen = new HashSet<>();
        for (int zoneId = 0; zoneId < result.getZones().size(); zoneId++) {
            Zone zone = result.getZones().get(zoneId);
            assertEquals(zoneId, zone.getZoneId());
            List<Integer> sorted = new ArrayList<>(zone.getMemberIds());
            sorted.sort(Integer::compare);
            assertEquals(sorted, zone.getMemberIds(), "members must be sorted by id");
            for (int id : zone.getMemberIds()) {
                assertTrue(seen.add(id), "stop " + id + " assigned twice");
            }
        }
        assertEquals(60, seen.size());
        assertFalse(seen.contains(LocationFixtures.DEPOT_ID));
    }

    @Test
    @DisplayName("Determinism: same input and seed give identical zones")
    void testDeterminism() {
        List<Location> locations = LocationFixtures.randomSquare(80, 3L);
        ZoneDecomposer decomposer = new ZoneDecomposer(SeedingStrategy.KMEANS_PLUS_PLUS, EmptyZonePolicy.RETAIN);

        ZoneDecomposition first = decomposer.decompose(locations, 6, 1234L, SolveBudget.of(100));
        ZoneDecomposition second = decomposer.decompose(locations, 6, 1234L, SolveBudget.of(100));

        assertEquals(first.getZones(), second.getZones());
        assertEquals(first.getIterations(), second.getIterations());
    }

    @Test
    @DisplayName("Budget: iteration cap yields a warning and a usable partition")
    void testIterationCap() {
        ZoneDecomposition result = new ZoneDecomposer().decompose(twoClusters(), 2, 42L, SolveBudget.of(1));

        NonConvergenceWarning warning = result.getWarning();
        assertNotNull(warning);
        assertEquals(NonConvergenceWarning.Stage.ZONE_DECOMPOSITION, warning.getStage());
        assertEquals(NonConvergenceWarning.Cause.ITERATION_CAP, warning.getCause());
        assertEquals(1, result.getIterations());

        int assigned = 0;
        for (Zone zone : result.getZones()) {
            assigned += zone.size();
        }
        assertEquals(6, assigned);
    }

    @Test
    @DisplayName("Edge: coincident stops with k above distinct coordinates leave empty zones")
    void testCoincidentStops() {
        List<Location> locations = List.of(
                LocationFixtures.depot(17.0, 78.0),
                LocationFixtures.stop(1, 17.5, 78.25),
                LocationFixtures.stop(2, 17.5, 78.25),
                LocationFixtures.stop(3, 17.5, 78.25)
        );
        ZoneDecomposition result = new ZoneDecomposer().decompose(locations, 2, 42L, SolveBudget.of(100));

        assertTrue(result.converged());
        assertEquals(List.of(1, 2, 3), result.getZones().get(0).getMemberIds());
        assertTrue(result.getZones().get(1).isEmpty());
    }

    @Test
    @DisplayName("Validation: zone count, stop count and depot count")
    void testValidation() {
        ZoneDecomposer decomposer = new ZoneDecomposer();

        ValidationException zero = assertThrows(ValidationException.class,
                () -> decomposer.decompose(twoClusters(), 0, 42L, SolveBudget.of(100)));
        assertEquals(ValidationException.REASON_INVALID_ZONE_COUNT, zero.getReasonCode());
        assertThrows(ValidationException.class,
                () -> decomposer.decompose(twoClusters(), 7, 42L, SolveBudget.of(100)));

        InsufficientDataException noStops = assertThrows(InsufficientDataException.class,
                () -> decomposer.decompose(List.of(LocationFixtures.depot(0.0, 0.0)), 1, 42L, SolveBudget.of(100)));
        assertEquals(InsufficientDataException.REASON_NO_STOPS, noStops.getReasonCode());

        ValidationException depots = assertThrows(ValidationException.class, () -> decomposer.decompose(List.of(
                LocationFixtures.depot(0.0, 0.0),
                LocationFixtures.location(1, 0.0, 1.0, true)
        ), 1, 42L, SolveBudget.of(100)));
        assertEquals(ValidationException.REASON_DEPOT_COUNT, depots.getReasonCode());
    }
}
