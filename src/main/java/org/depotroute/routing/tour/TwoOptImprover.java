package org.depotroute.routing.tour;

import lombok.experimental.UtilityClass;
import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.NonConvergenceWarning;

import java.util.Objects;

/**
 * First-improvement 2-opt local search over a closed tour with fixed endpoints.
 * <p>
 * For positions {@code 1 <= i < k <= n-2} the move reverses {@code tour[i..k]}, replacing
 * edges {@code (i-1, i)} and {@code (k, k+1)} with {@code (i-1, k)} and {@code (i, k+1)}:
 * </p>
 * <pre>
 * delta = d(t[i-1], t[k]) + d(t[i], t[k+1]) - d(t[i-1], t[i]) - d(t[k], t[k+1])
 * </pre>
 * <p>
 * A move is applied as soon as {@code delta < -IMPROVEMENT_EPSILON_KM} and the scan goes on
 * with the updated tour. The tolerance keeps zero-length moves between coincident points
 * from being re-applied forever. Tour length never increases.
 * </p>
 */
@UtilityClass
public final class TwoOptImprover {
    /** Minimum gain for a move to count as an improvement. */
    public static final double IMPROVEMENT_EPSILON_KM = 1e-9d;

    /**
     * Improves a tour until a full pass finds no move or the budget is exhausted.
     *
     * @param initialTour closed tour; not modified.
     * @param distance node distance function.
     * @param budget pass cap and time budget.
     * @return improved tour with pass statistics.
     */
    public static TwoOptResult improve(int[] initialTour, NodeDistance distance, SolveBudget budget) {
        Objects.requireNonNull(initialTour, "initialTour");
        Objects.requireNonNull(distance, "distance");
        Objects.requireNonNull(budget, "budget");

        int[] tour = initialTour.clone();
        int n = tour.length;
        // fewer than two interior nodes leaves nothing to reverse
        if (n < 5) {
            return new TwoOptResult(tour, TourLength.of(tour, distance), 0, 0, null);
        }

        int passes = 0;
        int moves = 0;
        NonConvergenceWarning.Cause stopCause;
        while (true) {
            stopCause = budget.check(passes);
            if (stopCause != null) {
                break;
            }
            passes++;
            int passMoves = scan(tour, distance, budget);
            moves += passMoves;
            if (passMoves == 0) {
                if (budget.timeExpired()) {
                    stopCause = NonConvergenceWarning.Cause.TIME_BUDGET;
                }
                break;
            }
        }
        return new TwoOptResult(tour, TourLength.of(tour, distance), passes, moves, stopCause);
    }

    /**
     * One full scan of all non-adjacent edge pairs. Returns number of applied moves.
     * Stops early, with the tour still valid, when the time budget runs out.
     */
    private static int scan(int[] tour, NodeDistance distance, SolveBudget budget) {
        int n = tour.length;
        int moves = 0;
        for (int i = 1; i < n - 2; i++) {
            if (budget.timeExpired()) {
                return moves;
            }
            for (int k = i + 1; k < n - 1; k++) {
                int a = tour[i - 1];
                int b = tour[i];
                int c = tour[k];
                int d = tour[k + 1];
                double delta = distance.between(a, c) + distance.between(b, d)
                        - distance.between(a, b) - distance.between(c, d);
                if (delta < -IMPROVEMENT_EPSILON_KM) {
                    reverse(tour, i, k);
                    moves++;
                }
            }
        }
        return moves;
    }

    private static void reverse(int[] tour, int from, int to) {
        while (from < to) {
            int tmp = tour[from];
            tour[from] = tour[to];
            tour[to] = tmp;
            from++;
            to--;
        }
    }
}
