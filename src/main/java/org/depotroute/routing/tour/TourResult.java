package org.depotroute.routing.tour;

import lombok.Value;
import org.depotroute.core.error.NonConvergenceWarning;

import java.util.List;

/**
 * Depot-to-depot tour over the members of one zone.
 */
@Value
public class TourResult {
    int zoneId;
    /** Location ids from depot to depot. */
    List<Integer> locationIds;
    /** Length of the nearest-neighbor construction. */
    double nearestNeighborKm;
    /** Length after 2-opt; never greater than {@link #nearestNeighborKm}. */
    double optimizedKm;
    int twoOptPasses;
    int improvingMoves;
    /** Present when 2-opt stopped on its budget. */
    NonConvergenceWarning warning;

    public TourResult(
            int zoneId,
            List<Integer> locationIds,
            double nearestNeighborKm,
            double optimizedKm,
            int twoOptPasses,
            int improvingMoves,
            NonConvergenceWarning warning
    ) {
        this.zoneId = zoneId;
        this.locationIds = List.copyOf(locationIds);
        this.nearestNeighborKm = nearestNeighborKm;
        this.optimizedKm = optimizedKm;
        this.twoOptPasses = twoOptPasses;
        this.improvingMoves = improvingMoves;
        this.warning = warning;
    }

    /**
     * Member ids in visiting order, without the depot endpoints.
     */
    public List<Integer> memberOrder() {
        return locationIds.subList(1, locationIds.size() - 1);
    }

    public boolean converged() {
        return warning == null;
    }
}
