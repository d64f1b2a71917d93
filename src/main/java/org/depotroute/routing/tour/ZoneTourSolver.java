package org.depotroute.routing.tour;

import lombok.experimental.UtilityClass;
import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.InsufficientDataException;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.model.Zone;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds and improves the depot-to-depot tour of one zone.
 *
 * <p>Local node 0 is the depot; nodes 1..m are the zone members in ascending id order,
 * so lower node index means lower location id for tie-breaking. Only reads the shared
 * matrix, so independent zones can be solved concurrently.</p>
 */
@UtilityClass
public final class ZoneTourSolver {
    private static final int DEPOT_NODE = 0;

    /**
     * Runs nearest-neighbor construction and 2-opt improvement for one zone.
     *
     * @param zone zone with at least one member.
     * @param depotId depot location id.
     * @param matrix shared distance matrix.
     * @param budget 2-opt pass cap and time budget.
     * @return zone tour and statistics.
     * @throws InsufficientDataException when the zone has no members.
     */
    public static TourResult solve(Zone zone, int depotId, DistanceMatrix matrix, SolveBudget budget) {
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(budget, "budget");
        if (zone.isEmpty()) {
            throw new InsufficientDataException(
                    InsufficientDataException.REASON_NO_STOPS,
                    "zone " + zone.getZoneId() + " has no members to tour"
            );
        }

        List<Integer> members = zone.getMemberIds();
        int nodeCount = members.size() + 1;
        int[] matrixIndex = new int[nodeCount];
        matrixIndex[DEPOT_NODE] = matrix.indexOf(depotId);
        for (int i = 0; i < members.size(); i++) {
            matrixIndex[i + 1] = matrix.indexOf(members.get(i));
        }
        NodeDistance distance = (from, to) -> matrix.distanceAt(matrixIndex[from], matrixIndex[to]);

        if (members.size() == 1) {
            int[] trivial = {DEPOT_NODE, 1, DEPOT_NODE};
            double length = TourLength.of(trivial, distance);
            return new TourResult(zone.getZoneId(), toLocationIds(trivial, matrixIndex, matrix), length, length, 0, 0, null);
        }

        int[] initial = NearestNeighborConstructor.construct(distance, nodeCount, DEPOT_NODE);
        double initialLength = TourLength.of(initial, distance);
        TwoOptResult improved = TwoOptImprover.improve(initial, distance, budget);

        NonConvergenceWarning warning = improved.converged()
                ? null
                : new NonConvergenceWarning(
                        NonConvergenceWarning.Stage.TWO_OPT,
                        zone.getZoneId(),
                        improved.passes(),
                        improved.stopCause()
                );
        return new TourResult(
                zone.getZoneId(),
                toLocationIds(improved.tour(), matrixIndex, matrix),
                initialLength,
                improved.length(),
                improved.passes(),
                improved.improvingMoves(),
                warning
        );
    }

    /**
     * Nearest-neighbor tour from the depot over the given members, without improvement.
     *
     * @param depotId depot location id.
     * @param memberIds non-depot location ids; visited with ties broken by lowest id.
     * @param matrix shared distance matrix.
     * @return location ids from depot to depot.
     */
    public static List<Integer> nearestNeighborTour(int depotId, List<Integer> memberIds, DistanceMatrix matrix) {
        Objects.requireNonNull(memberIds, "memberIds");
        Objects.requireNonNull(matrix, "matrix");
        int[] sortedMembers = memberIds.stream().mapToInt(Integer::intValue).sorted().toArray();
        int[] matrixIndex = new int[sortedMembers.length + 1];
        matrixIndex[DEPOT_NODE] = matrix.indexOf(depotId);
        for (int i = 0; i < sortedMembers.length; i++) {
            matrixIndex[i + 1] = matrix.indexOf(sortedMembers[i]);
        }
        NodeDistance distance = (from, to) -> matrix.distanceAt(matrixIndex[from], matrixIndex[to]);
        int[] tour = NearestNeighborConstructor.construct(distance, matrixIndex.length, DEPOT_NODE);
        return toLocationIds(tour, matrixIndex, matrix);
    }

    private static List<Integer> toLocationIds(int[] tour, int[] matrixIndex, DistanceMatrix matrix) {
        List<Integer> ids = new ArrayList<>(tour.length);
        for (int node : tour) {
            ids.add(matrix.locationIdAt(matrixIndex[node]));
        }
        return ids;
    }
}
