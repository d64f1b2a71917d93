package org.depotroute.routing.tour;

import org.depotroute.core.error.NonConvergenceWarning;

/**
 * Outcome of one 2-opt run.
 */
public final class TwoOptResult {
    private final int[] tour;
    private final double length;
    private final int passes;
    private final int improvingMoves;
    private final NonConvergenceWarning.Cause stopCause;

    TwoOptResult(int[] tour, double length, int passes, int improvingMoves, NonConvergenceWarning.Cause stopCause) {
        this.tour = tour;
        this.length = length;
        this.passes = passes;
        this.improvingMoves = improvingMoves;
        this.stopCause = stopCause;
    }

    public int[] tour() {
        return tour.clone();
    }

    public double length() {
        return length;
    }

    public int passes() {
        return passes;
    }

    public int improvingMoves() {
        return improvingMoves;
    }

    /**
     * Why the run stopped early, or {@code null} when a full pass found no improving move.
     */
    public NonConvergenceWarning.Cause stopCause() {
        return stopCause;
    }

    public boolean converged() {
        return stopCause == null;
    }
}
