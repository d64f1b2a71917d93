package org.depotroute.routing.model;

import lombok.Value;

import java.time.LocalTime;
import java.util.List;

/**
 * Arrival timeline for a route driven from a given departure time.
 */
@Value
public class RouteSchedule {
    LocalTime departure;
    List<StopArrival> arrivals;
    double totalTimeMinutes;

    public RouteSchedule(LocalTime departure, List<StopArrival> arrivals, double totalTimeMinutes) {
        this.departure = departure;
        this.arrivals = List.copyOf(arrivals);
        this.totalTimeMinutes = totalTimeMinutes;
    }

    /**
     * Arrival back at the depot.
     */
    public LocalTime getReturnTime() {
        return arrivals.get(arrivals.size() - 1).getArrival();
    }
}
