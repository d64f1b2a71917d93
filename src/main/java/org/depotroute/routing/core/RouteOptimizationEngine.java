package org.depotroute.routing.core;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.InsufficientDataException;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.core.error.ValidationException;
import org.depotroute.routing.cost.TravelCostConfig;
import org.depotroute.routing.cost.TravelCostModel;
import org.depotroute.routing.distance.DistanceMatrix;
import org.depotroute.routing.distance.DistanceMatrixBuilder;
import org.depotroute.routing.distance.DistanceMatrixCache;
import org.depotroute.routing.metrics.RouteComparator;
import org.depotroute.routing.metrics.RouteComparison;
import org.depotroute.routing.metrics.RouteMetricsAggregator;
import org.depotroute.routing.metrics.RouteValidator;
import org.depotroute.routing.model.GeoPoint;
import org.depotroute.routing.model.Location;
import org.depotroute.routing.model.LocationSets;
import org.depotroute.routing.model.Route;
import org.depotroute.routing.model.RouteMetrics;
import org.depotroute.routing.model.RouteSchedule;
import org.depotroute.routing.model.Zone;
import org.depotroute.routing.tour.RouteSplicer;
import org.depotroute.routing.tour.TourResult;
import org.depotroute.routing.tour.ZoneOrder;
import org.depotroute.routing.tour.ZoneOrderer;
import org.depotroute.routing.tour.ZoneTourSolver;
import org.depotroute.routing.zone.ZoneDecomposer;
import org.depotroute.routing.zone.ZoneDecomposition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main route optimization entry point.
 *
 * <p>The engine owns a bounded worker pool for per-zone solves and a single-slot
 * distance matrix cache. Execution flow of {@link #optimize(OptimizationRequest)}:</p>
 * <ul>
 * <li>Validate configuration, coordinates and the single-depot contract.</li>
 * <li>Build or reuse the distance matrix.</li>
 * <li>Decompose stops into zones with a seeded, reproducible clustering.</li>
 * <li>Fan out one nearest-neighbor + 2-opt solve per zone and join.</li>
 * <li>Order zones over their centroids and splice one depot-to-depot route.</li>
 * <li>Aggregate metrics, schedule and baseline comparison.</li>
 * </ul>
 * <p>Budget exhaustion never fails a solve: results carry {@link NonConvergenceWarning}s.</p>
 */
@Slf4j
@Accessors(fluent = true)
public final class RouteOptimizationEngine implements RouteOptimizerService, AutoCloseable {
    private static final long SHUTDOWN_WAIT_SECONDS = 5L;

    @Getter
    private final EngineConfig config;
    private final ExecutorService workers;
    private final ZoneFanOutSolver fanOutSolver;
    private final DistanceMatrixCache matrixCache = new DistanceMatrixCache();

    /**
     * Creates an engine from {@link EngineConfig#defaults()}.
     */
    public RouteOptimizationEngine() {
        this(EngineConfig.defaults());
    }

    /**
     * Creates an engine whose worker pool is sized by {@code config.workerThreads}.
     *
     * @throws ValidationException when the configuration is out of range.
     */
    public RouteOptimizationEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), new ZoneWorkerThreadFactory());
        this.fanOutSolver = new ZoneFanOutSolver(workers);
    }

    @Override
    public DistanceMatrix buildDistanceMatrix(List<Location> locations) {
        return DistanceMatrixBuilder.build(locations);
    }

    /**
     * Decomposes with this engine's seeding, empty-zone policy and iteration budget.
     */
    @Override
    public ZoneDecomposition decompose(List<Location> locations, int k, long seed) {
        return decompose(locations, k, seed, config, newBudget(config));
    }

    /**
     * Solves a route using the worker pool of this engine and the remaining settings of {@code config}.
     *
     * @throws ValidationException when zones do not partition the non-depot ids, or the hour is invalid.
     */
    @Override
    public Route solveRoute(
            List<Location> locations,
            DistanceMatrix distanceMatrix,
            List<Zone> zones,
            int hourOfDay,
            EngineConfig config
    ) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return solveRoute(locations, distanceMatrix, zones, hourOfDay, config, newBudget(config));
    }

    @Override
    public RouteMetrics computeMetrics(Route route, DistanceMatrix distanceMatrix, int hourOfDay, TravelCostConfig costConfig) {
        return RouteMetricsAggregator.computeMetrics(route, distanceMatrix, hourOfDay, costConfig);
    }

    /**
     * Runs the full pipeline. The zone count is clamped to the number of stops.
     */
    @Override
    public OptimizationResult optimize(OptimizationRequest request) {
        Objects.requireNonNull(request, "request");
        EngineConfig effective = request.getConfig() == null ? config : request.getConfig();
        effective.validate();
        Objects.requireNonNull(request.getDeparture(), "departure");

        List<Location> locations = request.getLocations();
        LocationSets.requireValidLocations(locations);
        Location depot = LocationSets.requireSingleDepot(locations);
        int stopCount = locations.size() - 1;
        if (stopCount < 1) {
            throw new InsufficientDataException(
                    InsufficientDataException.REASON_NO_STOPS,
                    "optimization needs at least one non-depot location"
            );
        }

        SolveBudget budget = newBudget(effective);
        DistanceMatrix matrix = matrixCache.getOrBuild(locations);
        int k = Math.min(effective.getKZones(), stopCount);
        ZoneDecomposition decomposition = decompose(locations, k, effective.getSeed(), effective, budget);
        int hourOfDay = request.getDeparture().getHour();
        Route route = solveRoute(locations, matrix, decomposition.getZones(), hourOfDay, effective, budget);

        RouteMetrics metrics = RouteMetricsAggregator.computeMetrics(route, matrix, hourOfDay, effective.getCostConfig());
        RouteSchedule schedule = RouteMetricsAggregator.schedule(route, matrix, request.getDeparture(), effective.getCostConfig());

        List<Integer> stopIds = new ArrayList<>(stopCount);
        for (Location location : LocationSets.stopsById(locations)) {
            stopIds.add(location.getId());
        }
        Route nearestNeighbor = new Route(
                depot.getId(),
                ZoneTourSolver.nearestNeighborTour(depot.getId(), stopIds, matrix),
                List.of()
        );
        Route naive = RouteComparator.naiveRoute(matrix, depot.getId());
        RouteComparison comparison = RouteComparator.compare(naive, nearestNeighbor, route, matrix);

        log.info("Optimized {} stops in {} zones: {} km, {} min (naive {} km, nearest neighbor {} km)",
                stopCount,
                k,
                String.format("%.2f", metrics.getTotalDistanceKm()),
                String.format("%.1f", metrics.getTotalTimeMinutes()),
                String.format("%.2f", comparison.getNaiveKm()),
                String.format("%.2f", comparison.getNearestNeighborKm()));

        return OptimizationResult.builder()
                .decomposition(decomposition)
                .route(route)
                .metrics(metrics)
                .schedule(schedule)
                .nearestNeighborRoute(nearestNeighbor)
                .comparison(comparison)
                .effectiveZones(k)
                .build();
    }

    /**
     * Returns a matrix from the engine cache, rebuilding when the location set changed.
     */
    public DistanceMatrix cachedDistanceMatrix(List<Location> locations) {
        return matrixCache.getOrBuild(locations);
    }

    /**
     * Stops the worker pool, waiting briefly for running zone solves.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ZoneDecomposition decompose(
            List<Location> locations,
            int k,
            long seed,
            EngineConfig config,
            SolveBudget budget
    ) {
        ZoneDecomposer decomposer = new ZoneDecomposer(config.getSeedingStrategy(), config.getEmptyZonePolicy());
        return decomposer.decompose(locations, k, seed, budget.withMaxIterations(config.getMaxKmeansIterations()));
    }

    private Route solveRoute(
            List<Location> locations,
            DistanceMatrix matrix,
            List<Zone> zones,
            int hourOfDay,
            EngineConfig config,
            SolveBudget budget
    ) {
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(zones, "zones");
        TravelCostModel.requireValidHour(hourOfDay);
        LocationSets.requireValidLocations(locations);
        Location depot = LocationSets.requireSingleDepot(locations);
        requireMatrixCovers(locations, matrix);
        requirePartition(locations, zones);

        SolveBudget tourBudget = budget.withMaxIterations(config.getMaxTwoOptPasses());
        List<TourResult> tours = fanOutSolver.solveAll(zones, depot.getId(), matrix, tourBudget);

        ZoneOrder order = new ZoneOrderer(config.getZoneOrderingStrategy())
                .order(zones, new GeoPoint(depot.getLatitude(), depot.getLongitude()), tourBudget);
        Map<Integer, TourResult> toursByZone = new HashMap<>();
        for (TourResult tour : tours) {
            toursByZone.put(tour.getZoneId(), tour);
        }
        List<TourResult> ordered = new ArrayList<>(tours.size());
        for (int zoneId : order.getZoneIds()) {
            ordered.add(toursByZone.get(zoneId));
        }

        List<NonConvergenceWarning> warnings = new ArrayList<>();
        for (TourResult tour : tours) {
            if (tour.getWarning() != null) {
                warnings.add(tour.getWarning());
            }
        }
        if (order.getWarning() != null) {
            warnings.add(order.getWarning());
        }
        for (NonConvergenceWarning warning : warnings) {
            log.warn("Route solve did not converge: {}", warning);
        }

        Route route = new Route(depot.getId(), RouteSplicer.splice(depot.getId(), ordered, matrix), warnings);
        RouteValidator.requireValid(route, matrix);
        log.debug("Solved {} zones at hour {} in order {}", tours.size(), hourOfDay, order.getZoneIds());
        return route;
    }

    /**
     * Zones must cover every non-depot id exactly once and nothing else.
     */
    private static void requirePartition(List<Location> locations, List<Zone> zones) {
        Map<Integer, Integer> owner = new HashMap<>();
        IntOpenHashSet zoneIds = new IntOpenHashSet(zones.size());
        for (Zone zone : zones) {
            Objects.requireNonNull(zone, "zone");
            if (!zoneIds.add(zone.getZoneId())) {
                throw new ValidationException(
                        ValidationException.REASON_ZONE_PARTITION,
                        "zone id " + zone.getZoneId() + " is used by more than one zone"
                );
            }
            for (int id : zone.getMemberIds()) {
                Integer previous = owner.put(id, zone.getZoneId());
                if (previous != null) {
                    throw new ValidationException(
                            ValidationException.REASON_ZONE_PARTITION,
                            "location " + id + " belongs to zones " + previous + " and " + zone.getZoneId()
                    );
                }
            }
        }
        int stops = 0;
        for (Location location : locations) {
            if (location.isDepot()) {
                if (owner.containsKey(location.getId())) {
                    throw new ValidationException(
                            ValidationException.REASON_ZONE_PARTITION,
                            "depot " + location.getId() + " must not belong to a zone"
                    );
                }
                continue;
            }
            stops++;
            if (!owner.containsKey(location.getId())) {
                throw new ValidationException(
                        ValidationException.REASON_ZONE_PARTITION,
                        "location " + location.getId() + " is not assigned to any zone"
                );
            }
        }
        if (owner.size() != stops) {
            throw new ValidationException(
                    ValidationException.REASON_ZONE_PARTITION,
                    "zones reference " + (owner.size() - stops) + " unknown location ids"
            );
        }
    }

    /**
     * The matrix must be built over exactly this location set.
     */
    private static void requireMatrixCovers(List<Location> locations, DistanceMatrix matrix) {
        if (matrix.size() != locations.size()) {
            throw new ValidationException(
                    ValidationException.REASON_UNKNOWN_LOCATION_ID,
                    "distance matrix has " + matrix.size() + " locations, expected " + locations.size()
            );
        }
        for (Location location : locations) {
            if (!matrix.containsLocation(location.getId())) {
                throw new ValidationException(
                        ValidationException.REASON_UNKNOWN_LOCATION_ID,
                        "location " + location.getId() + " is not part of the distance matrix"
                );
            }
        }
    }

    private static SolveBudget newBudget(EngineConfig config) {
        return SolveBudget.of(SolveBudget.UNBOUNDED, config.getTimeBudget());
    }

    /**
     * Daemon worker threads so an unclosed engine never blocks JVM exit.
     */
    private static final class ZoneWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "zone-solver-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
