package org.depotroute.routing.core;

import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.RouteEngineException;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.model.Zone;
import org.depotroute.routing.tour.TourResult;
import org.depotroute.routing.tour.ZoneTourSolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Solves independent zones as parallel tasks and joins on all of them.
 *
 * <p>Each task owns its zone tour; the only shared inputs are the immutable matrix and
 * budget. Results are collected in submission order, so output does not depend on
 * scheduling.</p>
 */
final class ZoneFanOutSolver {
    private final ExecutorService workers;

    ZoneFanOutSolver(ExecutorService workers) {
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Solves every non-empty zone and returns tours in ascending zone order.
     *
     * @throws RouteEngineException when a zone task fails or the join is interrupted.
     */
    List<TourResult> solveAll(List<Zone> zones, int depotId, DistanceMatrix matrix, SolveBudget budget) {
        List<Future<TourResult>> futures = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            if (zone.isEmpty()) {
                continue;
            }
            futures.add(workers.submit(() -> ZoneTourSolver.solve(zone, depotId, matrix, budget)));
        }

        List<TourResult> tours = new ArrayList<>(futures.size());
        try {
            for (Future<TourResult> future : futures) {
                tours.add(future.get());
            }
        } catch (InterruptedException ex) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RouteEngineException(
                    RouteEngineException.REASON_SOLVE_INTERRUPTED, "interrupted while joining zone solves", ex);
        } catch (ExecutionException ex) {
            cancelAll(futures);
            Throwable cause = ex.getCause();
            if (cause instanceof RouteEngineException) {
                throw (RouteEngineException) cause;
            }
            throw new RouteEngineException(
                    RouteEngineException.REASON_ZONE_SOLVE_FAILED, "zone solve failed: " + cause, cause);
        } catch (CancellationException ex) {
            throw new RouteEngineException(
                    RouteEngineException.REASON_ZONE_SOLVE_FAILED, "zone solve was cancelled", ex);
        }
        return tours;
    }

    private static void cancelAll(List<Future<TourResult>> futures) {
        for (Future<TourResult> future : futures) {
            future.cancel(true);
        }
    }
}
