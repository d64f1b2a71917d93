package org.depotroute.core.geo;

import lombok.experimental.UtilityClass;
import org.depotroute.core.error.ValidationException;

/**
 * Numeric helpers for coordinate validation and distance computations.
 */
@UtilityClass
public final class GeoDistance {
    /** Mean Earth radius used by the haversine formula. */
    public static final double EARTH_RADIUS_KM = 6371.0d;

    /**
     * Computes great-circle distance in kilometers using the haversine formulation.
     *
     * @throws ValidationException when any coordinate is out of range or non-finite.
     */
    public static double haversineKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        requireValidCoordinate(lat1Deg, lon1Deg);
        requireValidCoordinate(lat2Deg, lon2Deg);

        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(lon2Deg - lon1Deg);

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.atan2(Math.sqrt(clampedA), Math.sqrt(1.0d - clampedA));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Computes squared Euclidean distance in raw (lat, lon) degree space.
     */
    public static double squaredEuclidean(double lat1, double lon1, double lat2, double lon2) {
        double dLat = lat2 - lat1;
        double dLon = lon2 - lon1;
        return dLat * dLat + dLon * dLon;
    }

    /**
     * Validates one latitude/longitude pair.
     *
     * @throws ValidationException when latitude is outside [-90, 90] or longitude outside [-180, 180].
     */
    public static void requireValidCoordinate(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw new ValidationException(
                    ValidationException.REASON_LATITUDE_OUT_OF_RANGE,
                    "latitude must be within [-90, 90], got " + latitude
            );
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw new ValidationException(
                    ValidationException.REASON_LONGITUDE_OUT_OF_RANGE,
                    "longitude must be within [-180, 180], got " + longitude
            );
        }
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
