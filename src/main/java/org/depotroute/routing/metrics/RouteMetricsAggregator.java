package org.depotroute.routing.metrics;

import lombok.experimental.UtilityClass;
import org.depotroute.core.error.InvalidRouteException;
import org.depotroute.routing.cost.CostEstimate;
import org.depotroute.routing.cost.TravelCostConfig;
import org.depotroute.routing.cost.TravelCostModel;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.model.Route;
import org.depotroute.routing.model.RouteMetrics;
import org.depotroute.routing.model.RouteSchedule;
import org.depotroute.routing.model.RouteSegment;
import org.depotroute.routing.model.StopArrival;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a route into distance, time, cost and emission totals.
 */
@UtilityClass
public final class RouteMetricsAggregator {
    private static final double SECONDS_PER_MINUTE = 60.0d;

    /**
     * Walks consecutive route pairs, including the closing leg to the depot, and sums
     * matrix distance and per-leg travel time at a fixed hour of day.
     *
     * @throws InvalidRouteException when the route is not a valid depot-anchored cycle.
     */
    public static RouteMetrics computeMetrics(
            Route route,
            DistanceMatrix matrix,
            int hourOfDay,
            TravelCostConfig costConfig
    ) {
        TravelCostModel model = new TravelCostModel(Objects.requireNonNull(costConfig, "costConfig"));
        TravelCostModel.requireValidHour(hourOfDay);
        RouteValidator.requireValid(route, matrix);

        List<Integer> ids = route.getStopIds();
        RouteMetrics.RouteMetricsBuilder builder = RouteMetrics.builder();
        double totalKm = 0.0d;
        double totalMinutes = 0.0d;
        for (int i = 0; i + 1 < ids.size(); i++) {
            int from = ids.get(i);
            int to = ids.get(i + 1);
            double km = matrix.distanceKm(from, to);
            double minutes = model.estimateTravelTime(km, hourOfDay);
            totalKm += km;
            totalMinutes += minutes;
            builder.segment(new RouteSegment(from, to, km, minutes));
        }

        CostEstimate cost = model.estimateCost(totalKm);
        int legs = ids.size() - 1;
        return builder
                .totalDistanceKm(totalKm)
                .totalTimeMinutes(totalMinutes)
                .fuelCost(cost.getFuelCost())
                .co2Kg(cost.getCo2Kg())
                .stopCount(route.stopCount())
                .averageDistancePerStopKm(legs == 0 ? 0.0d : totalKm / legs)
                .build();
    }

    /**
     * Produces per-stop arrival times when leaving the depot at {@code departure}.
     *
     * <p>The traffic bucket is re-evaluated from the clock at the start of every leg, so a
     * route that drifts into a peak hour slows down from that leg on. Clock times wrap at
     * midnight while elapsed minutes keep growing.</p>
     *
     * @throws InvalidRouteException when the route is not a valid depot-anchored cycle.
     */
    public static RouteSchedule schedule(
            Route route,
            DistanceMatrix matrix,
            LocalTime departure,
            TravelCostConfig costConfig
    ) {
        Objects.requireNonNull(departure, "departure");
        TravelCostModel model = new TravelCostModel(Objects.requireNonNull(costConfig, "costConfig"));
        RouteValidator.requireValid(route, matrix);

        List<Integer> ids = route.getStopIds();
        List<StopArrival> arrivals = new ArrayList<>(ids.size());
        arrivals.add(new StopArrival(0, ids.get(0), departure, 0.0d));
        double elapsedMinutes = 0.0d;
        for (int i = 0; i + 1 < ids.size(); i++) {
            LocalTime legStart = plusMinutes(departure, elapsedMinutes);
            double km = matrix.distanceKm(ids.get(i), ids.get(i + 1));
            elapsedMinutes += model.estimateTravelTime(km, legStart.getHour());
            arrivals.add(new StopArrival(i + 1, ids.get(i + 1), plusMinutes(departure, elapsedMinutes), elapsedMinutes));
        }
        return new RouteSchedule(departure, arrivals, elapsedMinutes);
    }

    private static LocalTime plusMinutes(LocalTime base, double minutes) {
        return base.plusSeconds(Math.round(minutes * SECONDS_PER_MINUTE));
    }
}
