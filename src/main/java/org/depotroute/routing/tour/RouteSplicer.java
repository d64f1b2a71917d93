package org.depotroute.routing.tour;

import lombok.experimental.UtilityClass;
import org.depotroute.routing.distance.DistanceMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates zone tours into one depot-to-depot route.
 *
 * <p>Inner depot visits are dropped. Each zone's member sequence is entered from
 * whichever end is closer to the previous exit point; a closed tour has the same
 * length in both directions, so orientation only affects the connecting legs.</p>
 */
@UtilityClass
public final class RouteSplicer {

    /**
     * Splices zone tours in the given order.
     *
     * @param depotId depot location id.
     * @param toursInOrder zone tours in visiting order.
     * @param matrix distance matrix used to pick each tour's orientation.
     * @return location ids starting and ending at the depot.
     */
    public static List<Integer> splice(int depotId, List<TourResult> toursInOrder, DistanceMatrix matrix) {
        Objects.requireNonNull(toursInOrder, "toursInOrder");
        Objects.requireNonNull(matrix, "matrix");

        List<Integer> route = new ArrayList<>();
        route.add(depotId);
        int exit = depotId;
        for (TourResult tour : toursInOrder) {
            List<Integer> members = new ArrayList<>(tour.memberOrder());
            if (members.isEmpty()) {
                continue;
            }
            int head = members.get(0);
            int tail = members.get(members.size() - 1);
            if (matrix.distanceKm(exit, tail) < matrix.distanceKm(exit, head)) {
                Collections.reverse(members);
            }
            route.addAll(members);
            exit = members.get(members.size() - 1);
        }
        route.add(depotId);
        return route;
    }
}
