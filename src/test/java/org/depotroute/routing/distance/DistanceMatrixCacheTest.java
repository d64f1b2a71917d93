package org.depotroute.routing.distance;

import org.depotroute.routing.model.Location;
import org.depotroute.testutil.LocationFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistanceMatrixCacheTest {

    @Test
    @DisplayName("Cache: identical location set reuses the matrix")
    void testHit() {
        DistanceMatrixCache cache = new DistanceMatrixCache();
        List<Location> locations = LocationFixtures.hyderabad();

        DistanceMatrix first = cache.getOrBuild(locations);
        DistanceMatrix second = cache.getOrBuild(new ArrayList<>(locations));

        assertSame(first, second);
        assertTrue(cache.isCached(locations));
    }

    @Test
    @DisplayName("Cache: moved coordinate or reordered set rebuilds")
    void testMiss() {
        DistanceMatrixCache cache = new DistanceMatrixCache();
        List<Location> locations = new ArrayList<>(LocationFixtures.hyderabad());
        DistanceMatrix first = cache.getOrBuild(locations);

        List<Location> moved = new ArrayList<>(locations);
        moved.set(2, LocationFixtures.stop(2, 17.4240, 78.3460));
        assertFalse(cache.isCached(moved));
        DistanceMatrix second = cache.getOrBuild(moved);
        assertNotSame(first, second);

        List<Location> reordered = new ArrayList<>(moved);
        reordered.add(reordered.remove(1));
        assertNotSame(second, cache.getOrBuild(reordered));
    }

    @Test
    @DisplayName("Cache: invalidate drops the entry")
    void testInvalidate() {
        DistanceMatrixCache cache = new DistanceMatrixCache();
        List<Location> locations = LocationFixtures.line(4);
        DistanceMatrix first = cache.getOrBuild(locations);

        cache.invalidate();

        assertFalse(cache.isCached(locations));
        assertNotSame(first, cache.getOrBuild(locations));
    }
}
