package org.depotroute.routing.model;

import lombok.Value;
import org.depotroute.core.error.NonConvergenceWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered visit sequence starting and ending at the depot.
 *
 * <p>Warnings record stages that stopped on their budget; the route is still a
 * valid cycle in that case, only possibly less improved.</p>
 */
@Value
public class Route {
    int depotId;
    List<Integer> stopIds;
    List<NonConvergenceWarning> warnings;

    public Route(int depotId, List<Integer> stopIds, List<NonConvergenceWarning> warnings) {
        this.depotId = depotId;
        this.stopIds = List.copyOf(stopIds);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Creates a route without warnings from an explicit id sequence.
     */
    public static Route of(int depotId, int... stopIds) {
        List<Integer> ids = new ArrayList<>(stopIds.length);
        for (int id : stopIds) {
            ids.add(id);
        }
        return new Route(depotId, ids, List.of());
    }

    /**
     * Number of non-depot stops visited.
     */
    public int stopCount() {
        return Math.max(0, stopIds.size() - 2);
    }

    public boolean converged() {
        return warnings.isEmpty();
    }
}
