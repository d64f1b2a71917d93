package org.depotroute.routing.cost;

import lombok.Builder;
import lombok.Value;
import org.depotroute.core.error.ValidationException;

import java.util.Set;

/**
 * Static traffic and cost parameters for converting distance into time, fuel and CO2.
 *
 * <p>Passed explicitly into every call; nothing here is held as shared mutable state.</p>
 */
@Value
@Builder(toBuilder = true)
public class TravelCostConfig {
    /** Baseline average speed in km/h. */
    @Builder.Default
    double speedKmph = 30.0d;

    /** Hours of day (0..23) that use {@link #peakMultiplier}. Default covers 08-10 and 17-19. */
    @Builder.Default
    Set<Integer> peakHours = Set.of(8, 9, 17, 18);

    /** Travel-time multiplier applied inside peak hours. */
    @Builder.Default
    double peakMultiplier = 1.5d;

    /** Travel-time multiplier applied outside peak hours. */
    @Builder.Default
    double offpeakMultiplier = 1.0d;

    /** Fuel cost per km: 95 per liter at 12 km per liter. */
    @Builder.Default
    double fuelCostPerKm = 95.0d / 12.0d;

    /** Emission factor per km: 2.31 kg per liter at 12 km per liter. */
    @Builder.Default
    double co2KgPerKm = 2.31d / 12.0d;

    /**
     * Returns the default configuration.
     */
    public static TravelCostConfig defaults() {
        return TravelCostConfig.builder().build();
    }

    /**
     * Checks ranges of every parameter.
     *
     * @throws ValidationException on the first violated range.
     */
    public void validate() {
        requirePositive(speedKmph, "speedKmph");
        requirePositive(peakMultiplier, "peakMultiplier");
        requirePositive(offpeakMultiplier, "offpeakMultiplier");
        requireNonNegative(fuelCostPerKm, "fuelCostPerKm");
        requireNonNegative(co2KgPerKm, "co2KgPerKm");
        if (peakHours == null) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, "peakHours must be non-null");
        }
        for (Integer hour : peakHours) {
            if (hour == null || hour < 0 || hour > 23) {
                throw new ValidationException(
                        ValidationException.REASON_INVALID_CONFIG,
                        "peakHours entries must be within [0, 23], got " + hour
                );
            }
        }
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, name + " must be > 0, got " + value);
        }
    }

    private static void requireNonNegative(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, name + " must be >= 0, got " + value);
        }
    }
}
