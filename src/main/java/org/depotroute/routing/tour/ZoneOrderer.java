package org.depotroute.routing.tour;

import lombok.extern.slf4j.Slf4j;
import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.core.geo.GeoDistance;
import org.depotroute.routing.model.GeoPoint;
import org.depotroute.routing.model.Zone;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders zones by treating each non-empty zone as one node at its centroid.
 *
 * <p>Node 0 is the depot; nodes 1..z are the non-empty zones in ascending zone id.
 * Distances are haversine kilometers between the points. Empty zones are skipped.</p>
 */
@Slf4j
public final class ZoneOrderer {
    /** Largest zone count solved exactly; Held-Karp needs {@code 2^z * z} states. */
    public static final int MAX_EXACT_ZONES = 12;

    private final ZoneOrderingStrategy strategy;

    public ZoneOrderer(ZoneOrderingStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * Computes the visiting order of the non-empty zones.
     *
     * @param zones all zones; empty ones are ignored.
     * @param depot depot coordinates.
     * @param budget pass cap and time budget for the heuristic strategy.
     * @return zone ids in visiting order.
     */
    public ZoneOrder order(List<Zone> zones, GeoPoint depot, SolveBudget budget) {
        Objects.requireNonNull(zones, "zones");
        Objects.requireNonNull(depot, "depot");
        Objects.requireNonNull(budget, "budget");

        List<Zone> nonEmpty = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            if (!zone.isEmpty()) {
                nonEmpty.add(zone);
            }
        }
        nonEmpty.sort(Comparator.comparingInt(Zone::getZoneId));
        if (nonEmpty.isEmpty()) {
            return new ZoneOrder(List.of(), 0.0d, strategy, null);
        }

        int nodeCount = nonEmpty.size() + 1;
        double[] lat = new double[nodeCount];
        double[] lon = new double[nodeCount];
        lat[0] = depot.getLatitude();
        lon[0] = depot.getLongitude();
        for (int i = 0; i < nonEmpty.size(); i++) {
            lat[i + 1] = nonEmpty.get(i).getCentroid().getLatitude();
            lon[i + 1] = nonEmpty.get(i).getCentroid().getLongitude();
        }
        double[][] table = new double[nodeCount][nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            for (int j = i + 1; j < nodeCount; j++) {
                double km = GeoDistance.haversineKm(lat[i], lon[i], lat[j], lon[j]);
                table[i][j] = km;
                table[j][i] = km;
            }
        }
        NodeDistance distance = (from, to) -> table[from][to];

        int[] tour;
        ZoneOrderingStrategy applied = strategy;
        NonConvergenceWarning warning = null;
        if (strategy == ZoneOrderingStrategy.EXACT && nonEmpty.size() <= MAX_EXACT_ZONES) {
            tour = heldKarp(table);
        } else {
            if (strategy == ZoneOrderingStrategy.EXACT) {
                log.info("{} zones exceed exact ordering limit {}, using heuristic ordering",
                        nonEmpty.size(), MAX_EXACT_ZONES);
                applied = ZoneOrderingStrategy.HEURISTIC;
            }
            int[] initial = NearestNeighborConstructor.construct(distance, nodeCount, 0);
            TwoOptResult improved = TwoOptImprover.improve(initial, distance, budget);
            tour = improved.tour();
            if (!improved.converged()) {
                warning = new NonConvergenceWarning(
                        NonConvergenceWarning.Stage.ZONE_ORDERING,
                        NonConvergenceWarning.NO_ZONE,
                        improved.passes(),
                        improved.stopCause()
                );
            }
        }

        List<Integer> order = new ArrayList<>(nonEmpty.size());
        for (int i = 1; i < tour.length - 1; i++) {
            order.add(nonEmpty.get(tour[i] - 1).getZoneId());
        }
        return new ZoneOrder(order, TourLength.of(tour, distance), applied, warning);
    }

    /**
     * Exact shortest closed tour from node 0 by Held-Karp dynamic programming.
     * Ties resolve to the lowest predecessor index.
     */
    static int[] heldKarp(double[][] table) {
        int nodeCount = table.length;
        int z = nodeCount - 1;
        if (z == 0) {
            return new int[]{0, 0};
        }
        int full = (1 << z) - 1;
        double[][] cost = new double[1 << z][z];
        int[][] parent = new int[1 << z][z];
        for (double[] row : cost) {
            Arrays.fill(row, Double.POSITIVE_INFINITY);
        }
        for (int j = 0; j < z; j++) {
            cost[1 << j][j] = table[0][j + 1];
            parent[1 << j][j] = -1;
        }
        for (int mask = 1; mask <= full; mask++) {
            for (int last = 0; last < z; last++) {
                if ((mask & (1 << last)) == 0 || cost[mask][last] == Double.POSITIVE_INFINITY) {
                    continue;
                }
                for (int next = 0; next < z; next++) {
                    if ((mask & (1 << next)) != 0) {
                        continue;
                    }
                    int nextMask = mask | (1 << next);
                    double candidate = cost[mask][last] + table[last + 1][next + 1];
                    if (candidate < cost[nextMask][next]) {
                        cost[nextMask][next] = candidate;
                        parent[nextMask][next] = last;
                    }
                }
            }
        }

        int bestLast = 0;
        double best = Double.POSITIVE_INFINITY;
        for (int last = 0; last < z; last++) {
            double candidate = cost[full][last] + table[last + 1][0];
            if (candidate < best) {
                best = candidate;
                bestLast = last;
            }
        }

        int[] tour = new int[nodeCount + 1];
        int mask = full;
        int current = bestLast;
        for (int position = z; position >= 1; position--) {
            tour[position] = current + 1;
            int previous = parent[mask][current];
            mask &= ~(1 << current);
            current = previous;
        }
        tour[0] = 0;
        tour[nodeCount] = 0;
        return tour;
    }
}
