package org.depotroute.routing.model;

import lombok.Value;

import java.time.LocalTime;

/**
 * Estimated arrival at one stop of a scheduled route.
 */
@Value
public class StopArrival {
    /** Position in the route, 0 for the departure from the depot. */
    int position;
    int locationId;
    LocalTime arrival;
    /** Minutes elapsed since departure. */
    double elapsedMinutes;
}
