package org.depotroute.routing.model;

import lombok.Value;

/**
 * One leg of a route, in route order.
 */
@Value
public class RouteSegment {
    int fromId;
    int toId;
    double distanceKm;
    double timeMinutes;
}
