package org.depotroute.routing.tour;

/**
 * How the visiting order of zones is chosen from their centroids.
 */
public enum ZoneOrderingStrategy {
    /** Nearest neighbor from the depot followed by 2-opt, same as inside a zone. */
    HEURISTIC,
    /** Held-Karp dynamic programming; falls back to {@link #HEURISTIC} above {@link ZoneOrderer#MAX_EXACT_ZONES}. */
    EXACT
}
