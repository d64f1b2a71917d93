package org.depotroute.testutil;

import org.depotroute.routing.model.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Shared location sets for routing tests.
 */
public final class LocationFixtures {
    public static final int DEPOT_ID = 0;

    private LocationFixtures() {
    }

    public static Location depot(double latitude, double longitude) {
        return location(DEPOT_ID, latitude, longitude, true);
    }

    public static Location stop(int id, double latitude, double longitude) {
        return location(id, latitude, longitude, false);
    }

    public static Location location(int id, double latitude, double longitude, boolean depot) {
        return Location.builder()
                .id(id)
                .name(depot ? "Depot" : "Stop " + id)
                .latitude(latitude)
                .longitude(longitude)
                .locality("test")
                .packageCount(depot ? 0 : 1)
                .depot(depot)
                .build();
    }

    /**
     * Depot at the origin with stops 1..stopCount spaced 0.01 degrees apart along the equator.
     */
    public static List<Location> line(int stopCount) {
        List<Location> locations = new ArrayList<>(stopCount + 1);
        locations.add(depot(0.0, 0.0));
        for (int i = 1; i <= stopCount; i++) {
            locations.add(stop(i, 0.0, 0.01 * i));
        }
        return locations;
    }

    /**
     * Hyderabad depot with five nearby customers.
     */
    public static List<Location> hyderabad() {
        return List.of(
                depot(17.4485, 78.3908),
                stop(1, 17.4400, 78.3811),
                stop(2, 17.4239, 78.3460),
                stop(3, 17.4609, 78.3671),
                stop(4, 17.4950, 78.3595),
                stop(5, 17.4126, 78.4071)
        );
    }

    /**
     * Depot near the center of a square with seeded-random stops around it.
     */
    public static List<Location> randomSquare(int stopCount, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        List<Location> locations = new ArrayList<>(stopCount + 1);
        locations.add(depot(17.40, 78.40));
        for (int i = 1; i <= stopCount; i++) {
            locations.add(stop(i, 17.30 + random.nextDouble() * 0.2, 78.30 + random.nextDouble() * 0.2));
        }
        return locations;
    }
}
