package org.depotroute.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping between caller-facing location ids and dense matrix indices.
 */
public interface LocationIdMapper {

    /**
     * Converts a location id to its dense index.
     * @param locationId The client-facing location id.
     * @return The dense index in {@code [0, size)}.
     * @throws UnknownLocationException If the id is not mapped.
     */
    int toIndex(int locationId) throws UnknownLocationException;

    /**
     * Converts a dense index back to its location id.
     * @param index The dense index.
     * @return The client-facing location id.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    int toLocationId(int index);

    /**
     * Checks whether a location id is mapped.
     *
     * @param locationId id to test.
     * @return true when the id is present.
     */
    boolean containsLocation(int locationId);

    /**
     * Returns number of mapped ids.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Thrown when a location id cannot be found in the mapping.
     */
    @StandardException
    class UnknownLocationException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapper. The i-th id maps to index i.
     *
     * @param locationIdsInIndexOrder distinct location ids in dense index order.
     * @return An immutable mapper instance.
     */
    static LocationIdMapper createImmutable(int[] locationIdsInIndexOrder) {
        return new FastUtilLocationIdMapper(locationIdsInIndexOrder);
    }
}
