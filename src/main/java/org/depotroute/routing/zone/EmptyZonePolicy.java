package org.depotroute.routing.zone;

/**
 * What the update step does with a centroid that attracted no stops.
 */
public enum EmptyZonePolicy {
    /** Keep the previous centroid position. */
    RETAIN,
    /** Move the centroid onto the stop farthest from its own centroid. */
    RESEED_FARTHEST
}
