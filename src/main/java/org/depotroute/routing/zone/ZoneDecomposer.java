package org.depotroute.routing.zone;

import lombok.extern.slf4j.Slf4j;
import org.depotroute.core.budget.SolveBudget;
import org.depotroute.core.error.InsufficientDataException;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.core.error.ValidationException;
import org.depotroute.core.geo.GeoDistance;
import org.depotroute.routing.model.GeoPoint;
import org.depotroute.routing.model.Location;
import org.depotroute.routing.model.LocationSets;
import org.depotroute.routing.model.Zone;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Partitions non-depot stops into K zones with Lloyd's iterative centroid relocation.
 *
 * <p>Distances are squared Euclidean in raw (lat, lon) space. Stops are processed in
 * ascending id order and assignment ties go to the lowest centroid index, so identical
 * {@code (locations, k, seed)} always yield an identical partition.</p>
 */
@Slf4j
public final class ZoneDecomposer {
    private static final int UNASSIGNED = -1;

    private final SeedingStrategy seedingStrategy;
    private final EmptyZonePolicy emptyZonePolicy;

    /**
     * Creates a decomposer with {@link SeedingStrategy#FIRST_K_DISTINCT} and {@link EmptyZonePolicy#RETAIN}.
     */
    public ZoneDecomposer() {
        this(SeedingStrategy.FIRST_K_DISTINCT, EmptyZonePolicy.RETAIN);
    }

    public ZoneDecomposer(SeedingStrategy seedingStrategy, EmptyZonePolicy emptyZonePolicy) {
        this.seedingStrategy = Objects.requireNonNull(seedingStrategy, "seedingStrategy");
        this.emptyZonePolicy = Objects.requireNonNull(emptyZonePolicy, "emptyZonePolicy");
    }

    /**
     * Decomposes the non-depot stops of {@code locations} into exactly {@code k} zones.
     *
     * @param locations full location set including exactly one depot.
     * @param k zone count, {@code 1 <= k <= stop count}.
     * @param seed seed for randomized seeding strategies.
     * @param budget iteration cap and time budget; exhaustion yields a warning, not a failure.
     * @return zones indexed by zone id, plus convergence data.
     * @throws ValidationException on invalid coordinates, depot count or k.
     * @throws InsufficientDataException when there are no non-depot stops.
     */
    public ZoneDecomposition decompose(List<Location> locations, int k, long seed, SolveBudget budget) {
        Objects.requireNonNull(budget, "budget");
        LocationSets.requireValidLocations(locations);
        LocationSets.requireSingleDepot(locations);
        List<Location> stops = LocationSets.stopsById(locations);
        if (stops.isEmpty()) {
            throw new InsufficientDataException(
                    InsufficientDataException.REASON_NO_STOPS,
                    "zone decomposition needs at least one non-depot location"
            );
        }
        if (k < 1 || k > stops.size()) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_ZONE_COUNT,
                    "k must be within [1, " + stops.size() + "], got " + k
            );
        }

        int n = stops.size();
        double[] lat = new double[n];
        double[] lon = new double[n];
        for (int i = 0; i < n; i++) {
            lat[i] = stops.get(i).getLatitude();
            lon[i] = stops.get(i).getLongitude();
        }

        double[] centroidLat = new double[k];
        double[] centroidLon = new double[k];
        switch (seedingStrategy) {
            case FIRST_K_DISTINCT -> seedFirstDistinct(lat, lon, centroidLat, centroidLon);
            case KMEANS_PLUS_PLUS -> seedKMeansPlusPlus(lat, lon, centroidLat, centroidLon, seed);
        }

        int[] assignment = new int[n];
        Arrays.fill(assignment, UNASSIGNED);
        int iterations = 0;
        NonConvergenceWarning warning = null;
        while (true) {
            // the first assignment always runs so the partition is never empty-handed
            if (iterations > 0) {
                NonConvergenceWarning.Cause cause = budget.check(iterations);
                if (cause != null) {
                    warning = new NonConvergenceWarning(
                            NonConvergenceWarning.Stage.ZONE_DECOMPOSITION,
                            NonConvergenceWarning.NO_ZONE,
                            iterations,
                            cause
                    );
                    break;
                }
            }
            iterations++;
            boolean changed = assign(lat, lon, centroidLat, centroidLon, assignment);
            if (!changed) {
                break;
            }
            update(lat, lon, centroidLat, centroidLon, assignment);
        }

        if (warning != null) {
            log.warn("Zone decomposition did not converge: {}", warning);
        } else {
            log.debug("Zone decomposition converged after {} iterations (k={}, stops={})", iterations, k, n);
        }
        return new ZoneDecomposition(buildZones(stops, assignment, centroidLat, centroidLon), iterations, warning);
    }

    /**
     * Assigns every stop to its nearest centroid. Returns whether any assignment changed.
     */
    private static boolean assign(double[] lat, double[] lon, double[] centroidLat, double[] centroidLon, int[] assignment) {
        boolean changed = false;
        for (int i = 0; i < lat.length; i++) {
            int best = 0;
            double bestDistance = GeoDistance.squaredEuclidean(lat[i], lon[i], centroidLat[0], centroidLon[0]);
            for (int c = 1; c < centroidLat.length; c++) {
                double distance = GeoDistance.squaredEuclidean(lat[i], lon[i], centroidLat[c], centroidLon[c]);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = c;
                }
            }
            if (assignment[i] != best) {
                assignment[i] = best;
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Moves centroids to the mean of their members and applies the empty-zone policy.
     */
    private void update(double[] lat, double[] lon, double[] centroidLat, double[] centroidLon, int[] assignment) {
        int k = centroidLat.length;
        double[] sumLat = new double[k];
        double[] sumLon = new double[k];
        int[] counts = new int[k];
        for (int i = 0; i < lat.length; i++) {
            int c = assignment[i];
            sumLat[c] += lat[i];
            sumLon[c] += lon[i];
            counts[c]++;
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] > 0) {
                centroidLat[c] = sumLat[c] / counts[c];
                centroidLon[c] = sumLon[c] / counts[c];
            }
        }
        if (emptyZonePolicy == EmptyZonePolicy.RESEED_FARTHEST) {
            reseedEmpty(lat, lon, centroidLat, centroidLon, assignment, counts);
        }
    }

    /**
     * Places each empty centroid on the stop farthest from its own centroid, taking stops
     * only from zones that keep at least one member.
     */
    private static void reseedEmpty(
            double[] lat,
            double[] lon,
            double[] centroidLat,
            double[] centroidLon,
            int[] assignment,
            int[] counts
    ) {
        boolean[] used = new boolean[lat.length];
        for (int c = 0; c < centroidLat.length; c++) {
            if (counts[c] > 0) {
                continue;
            }
            int farthest = UNASSIGNED;
            double farthestDistance = -1.0d;
            for (int i = 0; i < lat.length; i++) {
                int owner = assignment[i];
                if (used[i] || counts[owner] < 2) {
                    continue;
                }
                double distance = GeoDistance.squaredEuclidean(lat[i], lon[i], centroidLat[owner], centroidLon[owner]);
                if (distance > farthestDistance) {
                    farthestDistance = distance;
                    farthest = i;
                }
            }
            if (farthest == UNASSIGNED) {
                continue;
            }
            used[farthest] = true;
            counts[assignment[farthest]]--;
            counts[c]++;
            centroidLat[c] = lat[farthest];
            centroidLon[c] = lon[farthest];
        }
    }

    /**
     * Seeds centroids with the first K distinct coordinates; repeats them cyclically when
     * fewer than K distinct coordinates exist.
     */
    private static void seedFirstDistinct(double[] lat, double[] lon, double[] centroidLat, double[] centroidLon) {
        int k = centroidLat.length;
        int seeded = 0;
        for (int i = 0; i < lat.length && seeded < k; i++) {
            if (!isSeeded(lat[i], lon[i], centroidLat, centroidLon, seeded)) {
                centroidLat[seeded] = lat[i];
                centroidLon[seeded] = lon[i];
                seeded++;
            }
        }
        fillDuplicates(centroidLat, centroidLon, seeded);
    }

    /**
     * k-means++ seeding: the first centroid is uniform, the rest are sampled with probability
     * proportional to squared distance from the nearest chosen centroid.
     */
    private static void seedKMeansPlusPlus(
            double[] lat,
            double[] lon,
            double[] centroidLat,
            double[] centroidLon,
            long seed
    ) {
        SplittableRandom random = new SplittableRandom(seed);
        int n = lat.length;
        int k = centroidLat.length;
        int first = random.nextInt(n);
        centroidLat[0] = lat[first];
        centroidLon[0] = lon[first];
        int seeded = 1;

        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            nearest[i] = GeoDistance.squaredEuclidean(lat[i], lon[i], centroidLat[0], centroidLon[0]);
        }
        while (seeded < k) {
            double total = 0.0d;
            for (double d : nearest) {
                total += d;
            }
            if (total <= 0.0d) {
                break;
            }
            double target = random.nextDouble() * total;
            int chosen = UNASSIGNED;
            double cumulative = 0.0d;
            for (int i = 0; i < n; i++) {
                if (nearest[i] <= 0.0d) {
                    continue;
                }
                cumulative += nearest[i];
                chosen = i;
                if (cumulative > target) {
                    break;
                }
            }
            centroidLat[seeded] = lat[chosen];
            centroidLon[seeded] = lon[chosen];
            for (int i = 0; i < n; i++) {
                double d = GeoDistance.squaredEuclidean(lat[i], lon[i], centroidLat[seeded], centroidLon[seeded]);
                if (d < nearest[i]) {
                    nearest[i] = d;
                }
            }
            seeded++;
        }
        fillDuplicates(centroidLat, centroidLon, seeded);
    }

    private static boolean isSeeded(double lat, double lon, double[] centroidLat, double[] centroidLon, int seeded) {
        for (int c = 0; c < seeded; c++) {
            if (centroidLat[c] == lat && centroidLon[c] == lon) {
                return true;
            }
        }
        return false;
    }

    private static void fillDuplicates(double[] centroidLat, double[] centroidLon, int seeded) {
        for (int c = seeded; c < centroidLat.length; c++) {
            centroidLat[c] = centroidLat[c % seeded];
            centroidLon[c] = centroidLon[c % seeded];
        }
    }

    private static List<Zone> buildZones(
            List<Location> stops,
            int[] assignment,
            double[] centroidLat,
            double[] centroidLon
    ) {
        int k = centroidLat.length;
        List<List<Integer>> members = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            members.add(new ArrayList<>());
        }
        // stops are sorted by id, so member lists come out sorted
        for (int i = 0; i < stops.size(); i++) {
            members.get(assignment[i]).add(stops.get(i).getId());
        }
        List<Zone> zones = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            zones.add(new Zone(c, members.get(c), new GeoPoint(centroidLat[c], centroidLon[c])));
        }
        return zones;
    }
}
