package org.depotroute.routing.zone;

/**
 * Initial centroid placement for zone decomposition. Both modes are reproducible.
 */
public enum SeedingStrategy {
    /** First K stops with distinct coordinates in ascending id order; the seed is unused. */
    FIRST_K_DISTINCT,
    /** k-means++ weighted sampling driven by the seed. */
    KMEANS_PLUS_PLUS
}
