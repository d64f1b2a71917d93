package org.depotroute.routing.tour;

import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.distance.DistanceMatrixBuilder;
import org.depotroute.testutil.LocationFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RouteSplicerTest {

    private final DistanceMatrix matrix = DistanceMatrixBuilder.build(LocationFixtures.line(4));

    private static TourResult tour(int zoneId, Integer... ids) {
        return new TourResult(zoneId, List.of(ids), 0.0d, 0.0d, 0, 0, null);
    }

    @Test
    @DisplayName("Splice: inner depot visits dropped, zones entered from the closer end")
    void testOrientation() {
        List<Integer> route = RouteSplicer.splice(0, List.of(tour(0, 0, 2, 1, 0), tour(1, 0, 4, 3, 0)), matrix);
        assertEquals(List.of(0, 1, 2, 3, 4, 0), route);
    }

    @Test
    @DisplayName("Splice: zone order is respected")
    void testZoneOrder() {
        List<Integer> route = RouteSplicer.splice(0, List.of(tour(1, 0, 3, 4, 0), tour(0, 0, 1, 2, 0)), matrix);
        assertEquals(List.of(0, 3, 4, 2, 1, 0), route);
    }

    @Test
    @DisplayName("Edge: no tours leaves a depot-only route")
    void testNoTours() {
        assertEquals(List.of(0, 0), RouteSplicer.splice(0, List.of(), matrix));
    }
}
