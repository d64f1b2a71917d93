package org.depotroute.core.error;

/**
 * Not enough input to produce a result. No partial result is returned.
 */
public final class InsufficientDataException extends RouteEngineException {
    public static final String REASON_TOO_FEW_LOCATIONS = "TOO_FEW_LOCATIONS";
    public static final String REASON_NO_STOPS = "NO_STOPS";

    public InsufficientDataException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
