package org.depotroute.routing.metrics;

import lombok.experimental.UtilityClass;
import org.depotroute.core.error.InvalidRouteException;
import org.depotroute.core.error.ValidationException;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.model.Route;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Baseline routes and savings reports used to show what optimization buys.
 */
@UtilityClass
public final class RouteComparator {

    /**
     * Visits every non-depot location in ascending id order.
     */
    public static Route naiveRoute(DistanceMatrix matrix, int depotId) {
        int[] stops = stopIds(matrix, depotId);
        Arrays.sort(stops);
        return toRoute(depotId, stops);
    }

    /**
     * Visits every non-depot location in a shuffled order reproducible from {@code seed}.
     */
    public static Route randomRoute(DistanceMatrix matrix, int depotId, long seed) {
        int[] stops = stopIds(matrix, depotId);
        Arrays.sort(stops);
        SplittableRandom random = new SplittableRandom(seed);
        for (int i = stops.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = stops[i];
            stops[i] = stops[j];
            stops[j] = tmp;
        }
        return toRoute(depotId, stops);
    }

    /**
     * Total matrix distance of a validated route.
     *
     * @throws InvalidRouteException when the route is structurally invalid.
     */
    public static double routeDistanceKm(Route route, DistanceMatrix matrix) {
        RouteValidator.requireValid(route, matrix);
        List<Integer> ids = route.getStopIds();
        double total = 0.0d;
        for (int i = 0; i + 1 < ids.size(); i++) {
            total += matrix.distanceKm(ids.get(i), ids.get(i + 1));
        }
        return total;
    }

    /**
     * Compares naive, nearest-neighbor and optimized routes over the same matrix.
     */
    public static RouteComparison compare(Route naive, Route nearestNeighbor, Route optimized, DistanceMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix");
        return new RouteComparison(
                routeDistanceKm(naive, matrix),
                routeDistanceKm(nearestNeighbor, matrix),
                routeDistanceKm(optimized, matrix)
        );
    }

    private static int[] stopIds(DistanceMatrix matrix, int depotId) {
        Objects.requireNonNull(matrix, "matrix");
        if (!matrix.containsLocation(depotId)) {
            throw new ValidationException(
                    ValidationException.REASON_UNKNOWN_LOCATION_ID,
                    "depot " + depotId + " is not part of the distance matrix"
            );
        }
        int[] all = matrix.locationIds();
        int[] stops = new int[all.length - 1];
        int count = 0;
        for (int id : all) {
            if (id != depotId) {
                stops[count++] = id;
            }
        }
        return stops;
    }

    private static Route toRoute(int depotId, int[] stops) {
        List<Integer> ids = new ArrayList<>(stops.length + 2);
        ids.add(depotId);
        for (int id : stops) {
            ids.add(id);
        }
        ids.add(depotId);
        return new Route(depotId, ids, List.of());
    }
}
