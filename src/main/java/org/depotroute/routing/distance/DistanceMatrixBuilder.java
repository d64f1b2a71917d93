package org.depotroute.routing.distance;

import lombok.experimental.UtilityClass;
import org.depotroute.core.error.InsufficientDataException;
import org.depotroute.core.geo.GeoDistance;
import org.depotroute.core.id.LocationIdMapper;
import org.depotroute.routing.model.Location;
import org.depotroute.routing.model.LocationSets;

import java.util.List;
import java.util.Objects;

/**
 * Builds full pairwise haversine distance matrices.
 */
@UtilityClass
public final class DistanceMatrixBuilder {

    /**
     * Computes all pairwise distances in O(n^2) time and space.
     *
     * <p>Only the upper triangle is evaluated; the lower triangle is mirrored so the
     * result is exactly symmetric.</p>
     *
     * @param locations locations in row order.
     * @return immutable matrix.
     * @throws InsufficientDataException when fewer than two locations are supplied.
     */
    public static DistanceMatrix build(List<Location> locations) {
        Objects.requireNonNull(locations, "locations");
        if (locations.size() < 2) {
            throw new InsufficientDataException(
                    InsufficientDataException.REASON_TOO_FEW_LOCATIONS,
                    "distance matrix needs at least 2 locations, got " + locations.size()
            );
        }
        LocationSets.requireValidLocations(locations);

        int n = locations.size();
        int[] ids = new int[n];
        for (int i = 0; i < n; i++) {
            ids[i] = locations.get(i).getId();
        }

        double[] table = new double[n * n];
        for (int i = 0; i < n; i++) {
            Location from = locations.get(i);
            for (int j = i + 1; j < n; j++) {
                Location to = locations.get(j);
                double km = GeoDistance.haversineKm(
                        from.getLatitude(), from.getLongitude(),
                        to.getLatitude(), to.getLongitude()
                );
                table[i * n + j] = km;
                table[j * n + i] = km;
            }
        }
        return new DistanceMatrix(LocationIdMapper.createImmutable(ids), table);
    }
}
