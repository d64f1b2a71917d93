package org.depotroute.core.error;

/**
 * Thrown when a route is not a Hamiltonian cycle anchored at the depot.
 *
 * <p>Seeing this on an engine-produced route indicates an engine bug.</p>
 */
public final class InvalidRouteException extends RouteEngineException {
    public static final String REASON_TOO_SHORT = "ROUTE_TOO_SHORT";
    public static final String REASON_ENDPOINT_NOT_DEPOT = "ROUTE_ENDPOINT_NOT_DEPOT";
    public static final String REASON_DEPOT_IN_BODY = "ROUTE_DEPOT_IN_BODY";
    public static final String REASON_UNKNOWN_STOP = "ROUTE_UNKNOWN_STOP";
    public static final String REASON_DUPLICATE_STOP = "ROUTE_DUPLICATE_STOP";
    public static final String REASON_MISSING_STOP = "ROUTE_MISSING_STOP";

    public InvalidRouteException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
