package org.depotroute.routing.tour;

import lombok.experimental.UtilityClass;

/**
 * Greedy nearest-neighbor tour construction.
 *
 * <p>Time O(n^2) in node count. Callers number nodes so that a lower node index means
 * a lower location id; ties then go to the lowest id.</p>
 */
@UtilityClass
public final class NearestNeighborConstructor {

    /**
     * Builds a closed tour {@code start, ..., start} visiting every node once.
     *
     * @param distance node distance function.
     * @param nodeCount number of nodes, {@code >= 1}.
     * @param startNode anchor node (the depot).
     * @return tour of length {@code nodeCount + 1}.
     */
    public static int[] construct(NodeDistance distance, int nodeCount, int startNode) {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("nodeCount must be >= 1");
        }
        if (startNode < 0 || startNode >= nodeCount) {
            throw new IllegalArgumentException("startNode out of bounds: " + startNode);
        }
        int[] tour = new int[nodeCount + 1];
        boolean[] visited = new boolean[nodeCount];
        tour[0] = startNode;
        visited[startNode] = true;

        int current = startNode;
        for (int position = 1; position < nodeCount; position++) {
            int nearest = -1;
            double nearestDistance = Double.POSITIVE_INFINITY;
            for (int node = 0; node < nodeCount; node++) {
                if (visited[node]) {
                    continue;
                }
                double d = distance.between(current, node);
                if (nearest == -1 || d < nearestDistance) {
                    nearestDistance = d;
                    nearest = node;
                }
            }
            tour[position] = nearest;
            visited[nearest] = true;
            current = nearest;
        }
        tour[nodeCount] = startNode;
        return tour;
    }
}
