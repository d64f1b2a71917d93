package org.depotroute.routing.tour;

import lombok.Value;
import org.depotroute.core.error.NonConvergenceWarning;

import java.util.List;

/**
 * Visiting order of non-empty zones.
 */
@Value
public class ZoneOrder {
    /** Zone ids in visiting order. */
    List<Integer> zoneIds;
    /** Closed centroid tour length from the depot and back. */
    double centroidTourKm;
    /** Strategy that actually produced the order. */
    ZoneOrderingStrategy strategy;
    /** Present when heuristic ordering stopped on its budget. */
    NonConvergenceWarning warning;

    public ZoneOrder(List<Integer> zoneIds, double centroidTourKm, ZoneOrderingStrategy strategy, NonConvergenceWarning warning) {
        this.zoneIds = List.copyOf(zoneIds);
        this.centroidTourKm = centroidTourKm;
        this.strategy = strategy;
        this.warning = warning;
    }
}
