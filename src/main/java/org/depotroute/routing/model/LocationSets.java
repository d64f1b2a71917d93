package org.depotroute.routing.model;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.experimental.UtilityClass;
import org.depotroute.core.error.ValidationException;
import org.depotroute.core.geo.GeoDistance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Contract checks and views over a caller-supplied location set.
 */
@UtilityClass
public final class LocationSets {

    /**
     * Validates coordinates and id uniqueness of every location.
     */
    public static void requireValidLocations(List<Location> locations) {
        Objects.requireNonNull(locations, "locations");
        IntOpenHashSet seen = new IntOpenHashSet(locations.size());
        for (Location location : locations) {
            Objects.requireNonNull(location, "location");
            GeoDistance.requireValidCoordinate(location.getLatitude(), location.getLongitude());
            if (!seen.add(location.getId())) {
                throw new ValidationException(
                        ValidationException.REASON_DUPLICATE_LOCATION_ID,
                        "duplicate location id " + location.getId()
                );
            }
        }
    }

    /**
     * Returns the single depot of the set.
     *
     * @throws ValidationException when there is no depot or more than one.
     */
    public static Location requireSingleDepot(List<Location> locations) {
        Location depot = null;
        int depotCount = 0;
        for (Location location : locations) {
            if (location.isDepot()) {
                depot = location;
                depotCount++;
            }
        }
        if (depotCount != 1) {
            throw new ValidationException(
                    ValidationException.REASON_DEPOT_COUNT,
                    "exactly one depot is required, found " + depotCount
            );
        }
        return depot;
    }

    /**
     * Returns non-depot locations sorted by ascending id.
     */
    public static List<Location> stopsById(List<Location> locations) {
        List<Location> stops = new ArrayList<>(locations.size());
        for (Location location : locations) {
            if (!location.isDepot()) {
                stops.add(location);
            }
        }
        stops.sort(Comparator.comparingInt(Location::getId));
        return stops;
    }
}
