package org.depotroute.routing.tour;

import lombok.experimental.UtilityClass;

/**
 * Length of a closed tour given as a node sequence.
 */
@UtilityClass
public final class TourLength {

    /**
     * Sums distances of consecutive nodes. The sequence is expected to repeat its start node at the end.
     */
    public static double of(int[] tour, NodeDistance distance) {
        double total = 0.0d;
        for (int i = 0; i + 1 < tour.length; i++) {
            total += distance.between(tour[i], tour[i + 1]);
        }
        return total;
    }
}
