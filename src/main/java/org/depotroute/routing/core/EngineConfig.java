package org.depotroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.depotroute.core.error.ValidationException;
import org.depotroute.routing.cost.TravelCostConfig;
import org.depotroute.routing.tour.ZoneOrderingStrategy;
import org.depotroute.routing.zone.EmptyZonePolicy;
import org.depotroute.routing.zone.SeedingStrategy;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Engine-wide tuning passed explicitly into each solve.
 *
 * <p>{@link #defaults()} reads overrides from {@code depotroute.*} system properties;
 * malformed values fall back to built-in defaults.</p>
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {
    static final String PROP_K_ZONES = "depotroute.kZones";
    static final String PROP_SEED = "depotroute.seed";
    static final String PROP_MAX_TWO_OPT_PASSES = "depotroute.maxTwoOptPasses";
    static final String PROP_MAX_KMEANS_ITERATIONS = "depotroute.maxKmeansIterations";
    static final String PROP_WORKER_THREADS = "depotroute.workerThreads";
    static final String PROP_TIME_BUDGET_MILLIS = "depotroute.timeBudgetMillis";
    static final String PROP_SPEED_KMPH = "depotroute.speedKmph";
    static final String PROP_PEAK_HOURS = "depotroute.peakHours";
    static final String PROP_PEAK_MULTIPLIER = "depotroute.peakMultiplier";
    static final String PROP_OFFPEAK_MULTIPLIER = "depotroute.offpeakMultiplier";
    static final String PROP_FUEL_COST_PER_KM = "depotroute.fuelCostPerKm";
    static final String PROP_CO2_KG_PER_KM = "depotroute.co2KgPerKm";

    /** Number of zones to decompose stops into. */
    @Builder.Default
    int kZones = 4;

    /** Seed threaded through randomized seeding. */
    @Builder.Default
    long seed = 42L;

    /** Maximum 2-opt passes per tour. */
    @Builder.Default
    int maxTwoOptPasses = 1000;

    /** Maximum Lloyd iterations. */
    @Builder.Default
    int maxKmeansIterations = 100;

    @Builder.Default
    SeedingStrategy seedingStrategy = SeedingStrategy.FIRST_K_DISTINCT;

    @Builder.Default
    EmptyZonePolicy emptyZonePolicy = EmptyZonePolicy.RETAIN;

    @Builder.Default
    ZoneOrderingStrategy zoneOrderingStrategy = ZoneOrderingStrategy.HEURISTIC;

    /** Size of the per-zone worker pool. */
    @Builder.Default
    int workerThreads = Runtime.getRuntime().availableProcessors();

    /** Wall-clock budget for one solve; {@link Duration#ZERO} means unlimited. */
    @Builder.Default
    Duration timeBudget = Duration.ZERO;

    @Builder.Default
    TravelCostConfig costConfig = TravelCostConfig.defaults();

    /**
     * Built-in defaults overlaid with {@code depotroute.*} system properties.
     */
    public static EngineConfig defaults() {
        EngineConfig base = EngineConfig.builder().build();
        TravelCostConfig cost = base.getCostConfig();
        return base.toBuilder()
                .kZones(readInt(PROP_K_ZONES, base.getKZones()))
                .seed(readLong(PROP_SEED, base.getSeed()))
                .maxTwoOptPasses(readInt(PROP_MAX_TWO_OPT_PASSES, base.getMaxTwoOptPasses()))
                .maxKmeansIterations(readInt(PROP_MAX_KMEANS_ITERATIONS, base.getMaxKmeansIterations()))
                .workerThreads(readInt(PROP_WORKER_THREADS, base.getWorkerThreads()))
                .timeBudget(Duration.ofMillis(readLong(PROP_TIME_BUDGET_MILLIS, base.getTimeBudget().toMillis())))
                .costConfig(cost.toBuilder()
                        .speedKmph(readDouble(PROP_SPEED_KMPH, cost.getSpeedKmph()))
                        .peakHours(readHours(PROP_PEAK_HOURS, cost.getPeakHours()))
                        .peakMultiplier(readDouble(PROP_PEAK_MULTIPLIER, cost.getPeakMultiplier()))
                        .offpeakMultiplier(readDouble(PROP_OFFPEAK_MULTIPLIER, cost.getOffpeakMultiplier()))
                        .fuelCostPerKm(readDouble(PROP_FUEL_COST_PER_KM, cost.getFuelCostPerKm()))
                        .co2KgPerKm(readDouble(PROP_CO2_KG_PER_KM, cost.getCo2KgPerKm()))
                        .build())
                .build();
    }

    /**
     * Checks every parameter range, including the nested cost configuration.
     *
     * @throws ValidationException on the first violated range.
     */
    public void validate() {
        requirePositive(kZones, "kZones");
        requirePositive(maxTwoOptPasses, "maxTwoOptPasses");
        requirePositive(maxKmeansIterations, "maxKmeansIterations");
        requirePositive(workerThreads, "workerThreads");
        requireNonNull(seedingStrategy, "seedingStrategy");
        requireNonNull(emptyZonePolicy, "emptyZonePolicy");
        requireNonNull(zoneOrderingStrategy, "zoneOrderingStrategy");
        requireNonNull(timeBudget, "timeBudget");
        if (timeBudget.isNegative()) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, "timeBudget must be >= 0");
        }
        requireNonNull(costConfig, "costConfig");
        costConfig.validate();
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, name + " must be > 0, got " + value);
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new ValidationException(ValidationException.REASON_INVALID_CONFIG, name + " must be non-null");
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    /**
     * Parses a comma-separated hour list such as {@code 7,8,17}.
     */
    private static Set<Integer> readHours(String property, Set<Integer> fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            Set<Integer> hours = new LinkedHashSet<>();
            Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(token -> !token.isEmpty())
                    .map(Integer::parseInt)
                    .forEach(hours::add);
            return Set.copyOf(hours);
        } catch (NumberFormatException ex) {
            return Objects.requireNonNull(fallback, "fallback");
        }
    }
}
