package org.depotroute.routing.tour;

/**
 * Symmetric non-negative distance between local node indices of one tour problem.
 */
@FunctionalInterface
public interface NodeDistance {
    double between(int fromNode, int toNode);
}
