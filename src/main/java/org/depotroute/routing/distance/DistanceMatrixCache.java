package org.depotroute.routing.distance;

import lombok.extern.slf4j.Slf4j;
import org.depotroute.routing.model.Location;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot matrix cache keyed by the ordered location ids and their coordinates.
 *
 * <p>Any difference in order, id or coordinate rebuilds the matrix. Concurrent
 * callers may build the same matrix twice; the last writer wins, which is harmless
 * because the matrix is a pure function of the key.</p>
 */
@Slf4j
public final class DistanceMatrixCache {
    private final AtomicReference<Entry> slot = new AtomicReference<>();

    /**
     * Returns the cached matrix when the key matches, otherwise builds and caches a new one.
     */
    public DistanceMatrix getOrBuild(List<Location> locations) {
        Objects.requireNonNull(locations, "locations");
        Key key = Key.of(locations);
        Entry current = slot.get();
        if (current != null && current.key.equals(key)) {
            return current.matrix;
        }
        DistanceMatrix matrix = DistanceMatrixBuilder.build(locations);
        slot.set(new Entry(key, matrix));
        log.debug("Built distance matrix for {} locations", locations.size());
        return matrix;
    }

    /**
     * Drops the cached entry.
     */
    public void invalidate() {
        slot.set(null);
    }

    /**
     * Whether a matrix for exactly this location set is cached.
     */
    public boolean isCached(List<Location> locations) {
        Entry current = slot.get();
        return current != null && current.key.equals(Key.of(locations));
    }

    private static final class Entry {
        private final Key key;
        private final DistanceMatrix matrix;

        private Entry(Key key, DistanceMatrix matrix) {
            this.key = key;
            this.matrix = matrix;
        }
    }

    private static final class Key {
        private final int[] ids;
        private final double[] coordinates;
        private final int hash;

        private Key(int[] ids, double[] coordinates) {
            this.ids = ids;
            this.coordinates = coordinates;
            this.hash = 31 * Arrays.hashCode(ids) + Arrays.hashCode(coordinates);
        }

        static Key of(List<Location> locations) {
            int n = locations.size();
            int[] ids = new int[n];
            double[] coordinates = new double[n * 2];
            for (int i = 0; i < n; i++) {
                Location location = locations.get(i);
                ids[i] = location.getId();
                coordinates[2 * i] = location.getLatitude();
                coordinates[2 * i + 1] = location.getLongitude();
            }
            return new Key(ids, coordinates);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Key)) {
                return false;
            }
            Key that = (Key) other;
            return hash == that.hash
                    && Arrays.equals(ids, that.ids)
                    && Arrays.equals(coordinates, that.coordinates);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
