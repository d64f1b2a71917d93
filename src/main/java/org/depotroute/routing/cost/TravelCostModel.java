package org.depotroute.routing.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.depotroute.core.error.ValidationException;

import java.util.Objects;

/**
 * Converts distance into travel time, fuel cost and emissions.
 * <p>
 * Travel time follows:
 * </p>
 * <pre>
 * minutes = distance_km / speed_kmph * 60 * traffic_multiplier(hour)
 * traffic_multiplier(hour) = peak_multiplier if hour in peak_hours else offpeak_multiplier
 * </pre>
 * <p>
 * Fuel and CO2 are linear in distance. The model is stateless beyond its immutable
 * configuration and can be shared between threads.
 * </p>
 */
@Accessors(fluent = true)
public final class TravelCostModel {
    private static final double MINUTES_PER_HOUR = 60.0d;

    @Getter
    private final TravelCostConfig config;
    // indexed by hour of day
    private final double[] multiplierByHour = new double[24];

    /**
     * Creates a model after validating the configuration.
     *
     * @throws ValidationException when the configuration is out of range.
     */
    public TravelCostModel(TravelCostConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        for (int hour = 0; hour < multiplierByHour.length; hour++) {
            multiplierByHour[hour] = config.getPeakHours().contains(hour)
                    ? config.getPeakMultiplier()
                    : config.getOffpeakMultiplier();
        }
    }

    /**
     * Returns the traffic multiplier for an hour-of-day bucket.
     */
    public double trafficMultiplier(int hourOfDay) {
        requireValidHour(hourOfDay);
        return multiplierByHour[hourOfDay];
    }

    /**
     * Estimates travel minutes for a distance driven at the given hour.
     *
     * @throws ValidationException when distance is negative or hour is outside 0..23.
     */
    public double estimateTravelTime(double distanceKm, int hourOfDay) {
        requireNonNegativeDistance(distanceKm);
        double multiplier = trafficMultiplier(hourOfDay);
        return distanceKm / config.getSpeedKmph() * MINUTES_PER_HOUR * multiplier;
    }

    /**
     * Estimates fuel cost and CO2 for a distance.
     *
     * @throws ValidationException when distance is negative.
     */
    public CostEstimate estimateCost(double distanceKm) {
        requireNonNegativeDistance(distanceKm);
        return new CostEstimate(
                distanceKm * config.getFuelCostPerKm(),
                distanceKm * config.getCo2KgPerKm()
        );
    }

    /**
     * Validates an hour-of-day value.
     */
    public static void requireValidHour(int hourOfDay) {
        if (hourOfDay < 0 || hourOfDay > 23) {
            throw new ValidationException(
                    ValidationException.REASON_HOUR_OUT_OF_RANGE,
                    "hourOfDay must be within [0, 23], got " + hourOfDay
            );
        }
    }

    private static void requireNonNegativeDistance(double distanceKm) {
        if (!Double.isFinite(distanceKm) || distanceKm < 0.0d) {
            throw new ValidationException(
                    ValidationException.REASON_NEGATIVE_DISTANCE,
                    "distanceKm must be finite and >= 0, got " + distanceKm
            );
        }
    }
}
