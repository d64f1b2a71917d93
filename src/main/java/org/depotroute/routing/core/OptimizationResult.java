package org.depotroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.routing.metrics.RouteComparison;
import org.depotroute.routing.model.Route;
import org.depotroute.routing.model.RouteMetrics;
import org.depotroute.routing.model.RouteSchedule;
import org.depotroute.routing.zone.ZoneDecomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the presentation layer needs from one optimization run.
 */
@Value
@Builder
public class OptimizationResult {
    ZoneDecomposition decomposition;
    /** Optimized zoned route. */
    Route route;
    RouteMetrics metrics;
    RouteSchedule schedule;
    /** Single nearest-neighbor tour over all stops, without zoning or 2-opt. */
    Route nearestNeighborRoute;
    RouteComparison comparison;
    /** Effective zone count after clamping to the stop count. */
    int effectiveZones;

    /**
     * Warnings from every stage, decomposition first.
     */
    public List<NonConvergenceWarning> warnings() {
        List<NonConvergenceWarning> all = new ArrayList<>();
        if (decomposition.getWarning() != null) {
            all.add(decomposition.getWarning());
        }
        all.addAll(route.getWarnings());
        return all;
    }

    public boolean converged() {
        return warnings().isEmpty();
    }
}
