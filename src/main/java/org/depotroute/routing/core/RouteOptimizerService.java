package org.depotroute.routing.core;

import org.depotroute.routing.cost.TravelCostConfig;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.model.Location;
import org.depotroute.routing.model.Route;
import org.depotroute.routing.model.RouteMetrics;
import org.depotroute.routing.model.Zone;
import org.depotroute.routing.zone.ZoneDecomposition;

import java.util.List;

/**
 * Client-facing routing contract.
 */
public interface RouteOptimizerService {
    /**
     * Computes the pairwise distance matrix of a location set.
     */
    DistanceMatrix buildDistanceMatrix(List<Location> locations);

    /**
     * Partitions the non-depot locations into exactly {@code k} zones.
     */
    ZoneDecomposition decompose(List<Location> locations, int k, long seed);

    /**
     * Solves each zone, orders the zones and splices one depot-to-depot route.
     */
    Route solveRoute(List<Location> locations, DistanceMatrix distanceMatrix, List<Zone> zones, int hourOfDay, EngineConfig config);

    /**
     * Computes distance, time, cost and emission totals for a route.
     */
    RouteMetrics computeMetrics(Route route, DistanceMatrix distanceMatrix, int hourOfDay, TravelCostConfig costConfig);

    /**
     * Runs the whole pipeline for one request.
     */
    OptimizationResult optimize(OptimizationRequest request);
}
