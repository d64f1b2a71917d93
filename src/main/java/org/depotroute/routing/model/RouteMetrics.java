package org.depotroute.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Summary statistics derived from one route. Recomputed, never mutated.
 */
@Value
@Builder
public class RouteMetrics {
    /** Sum of matrix distances over all legs, including the closing leg. */
    double totalDistanceKm;
    /** Sum of per-leg travel times. */
    double totalTimeMinutes;
    /** Fuel cost for the total distance, in configured currency units. */
    double fuelCost;
    /** Emitted CO2 for the total distance. */
    double co2Kg;
    /** Non-depot stops visited. */
    int stopCount;
    /** Total distance divided by number of legs (0 for an empty route). */
    double averageDistancePerStopKm;
    /** Per-leg breakdown in route order. */
    @Singular
    List<RouteSegment> segments;
}
