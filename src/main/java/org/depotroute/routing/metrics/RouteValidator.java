package org.depotroute.routing.metrics;

import lombok.experimental.UtilityClass;
import org.depotroute.core.error.InvalidRouteException;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.model.Route;

import java.util.List;
import java.util.Objects;

/**
 * Checks that a route is a Hamiltonian cycle over the matrix locations anchored at the depot.
 */
@UtilityClass
public final class RouteValidator {

    /**
     * Validates route structure against the matrix location set.
     *
     * @throws InvalidRouteException on wrong endpoints, depot inside the body, unknown,
     *                               duplicate or missing stops.
     */
    public static void requireValid(Route route, DistanceMatrix matrix) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(matrix, "matrix");
        List<Integer> ids = route.getStopIds();
        int depotId = route.getDepotId();
        if (ids.size() < 2) {
            throw new InvalidRouteException(
                    InvalidRouteException.REASON_TOO_SHORT,
                    "route must contain at least the depot twice, got " + ids.size() + " ids"
            );
        }
        if (!matrix.containsLocation(depotId)) {
            throw new InvalidRouteException(
                    InvalidRouteException.REASON_UNKNOWN_STOP,
                    "depot " + depotId + " is not part of the distance matrix"
            );
        }
        if (ids.get(0) != depotId || ids.get(ids.size() - 1) != depotId) {
            throw new InvalidRouteException(
                    InvalidRouteException.REASON_ENDPOINT_NOT_DEPOT,
                    "route must start and end at depot " + depotId + ", got " + ids.get(0) + " .. " + ids.get(ids.size() - 1)
            );
        }

        boolean[] seen = new boolean[matrix.size()];
        for (int position = 1; position < ids.size() - 1; position++) {
            int id = ids.get(position);
            if (id == depotId) {
                throw new InvalidRouteException(
                        InvalidRouteException.REASON_DEPOT_IN_BODY,
                        "depot appears inside the route at position " + position
                );
            }
            if (!matrix.containsLocation(id)) {
                throw new InvalidRouteException(
                        InvalidRouteException.REASON_UNKNOWN_STOP,
                        "location " + id + " is not part of the distance matrix"
                );
            }
            int index = matrix.indexOf(id);
            if (seen[index]) {
                throw new InvalidRouteException(
                        InvalidRouteException.REASON_DUPLICATE_STOP,
                        "location " + id + " is visited more than once"
                );
            }
            seen[index] = true;
        }

        int depotIndex = matrix.indexOf(depotId);
        for (int index = 0; index < seen.length; index++) {
            if (index != depotIndex && !seen[index]) {
                throw new InvalidRouteException(
                        InvalidRouteException.REASON_MISSING_STOP,
                        "location " + matrix.locationIdAt(index) + " is never visited"
                );
            }
        }
    }
}
