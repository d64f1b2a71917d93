package org.depotroute.core.error;

/**
 * Malformed caller input: coordinates out of range, invalid zone count, invalid hour,
 * inconsistent configuration. Never retried internally.
 */
public final class ValidationException extends RouteEngineException {
    public static final String REASON_LATITUDE_OUT_OF_RANGE = "LATITUDE_OUT_OF_RANGE";
    public static final String REASON_LONGITUDE_OUT_OF_RANGE = "LONGITUDE_OUT_OF_RANGE";
    public static final String REASON_HOUR_OUT_OF_RANGE = "HOUR_OUT_OF_RANGE";
    public static final String REASON_NEGATIVE_DISTANCE = "NEGATIVE_DISTANCE";
    public static final String REASON_INVALID_ZONE_COUNT = "INVALID_ZONE_COUNT";
    public static final String REASON_DEPOT_COUNT = "DEPOT_COUNT";
    public static final String REASON_DUPLICATE_LOCATION_ID = "DUPLICATE_LOCATION_ID";
    public static final String REASON_UNKNOWN_LOCATION_ID = "UNKNOWN_LOCATION_ID";
    public static final String REASON_ZONE_PARTITION = "ZONE_PARTITION";
    public static final String REASON_INVALID_CONFIG = "INVALID_CONFIG";

    public ValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
