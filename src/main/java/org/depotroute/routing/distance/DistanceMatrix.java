package org.depotroute.routing.distance;

import org.depotroute.core.id.LocationIdMapper;

import java.util.Objects;

/**
 * Immutable symmetric distance table over a location set.
 *
 * <p>Rows and columns follow the order the locations were supplied in; lookups by
 * location id go through a {@link LocationIdMapper}. Instances are safe to share
 * between concurrent readers.</p>
 */
public final class DistanceMatrix {
    private final LocationIdMapper idMapper;
    private final int size;
    // row-major n*n table
    private final double[] distancesKm;

    DistanceMatrix(LocationIdMapper idMapper, double[] distancesKm) {
        this.idMapper = Objects.requireNonNull(idMapper, "idMapper");
        this.size = idMapper.size();
        if (distancesKm.length != size * size) {
            throw new IllegalArgumentException("distance table must have " + (size * size) + " cells");
        }
        this.distancesKm = distancesKm;
    }

    /**
     * Number of rows (and columns).
     */
    public int size() {
        return size;
    }

    /**
     * Distance between two location ids.
     *
     * @throws LocationIdMapper.UnknownLocationException when either id is not part of the matrix.
     */
    public double distanceKm(int fromId, int toId) {
        return distanceAt(idMapper.toIndex(fromId), idMapper.toIndex(toId));
    }

    /**
     * Distance between two dense indices.
     */
    public double distanceAt(int fromIndex, int toIndex) {
        return distancesKm[fromIndex * size + toIndex];
    }

    public int indexOf(int locationId) {
        return idMapper.toIndex(locationId);
    }

    public int locationIdAt(int index) {
        return idMapper.toLocationId(index);
    }

    public boolean containsLocation(int locationId) {
        return idMapper.containsLocation(locationId);
    }

    /**
     * Location ids in row order.
     */
    public int[] locationIds() {
        int[] ids = new int[size];
        for (int i = 0; i < size; i++) {
            ids[i] = idMapper.toLocationId(i);
        }
        return ids;
    }
}
