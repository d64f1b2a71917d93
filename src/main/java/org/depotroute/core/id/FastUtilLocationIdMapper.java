package org.depotroute.core.id;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

/**
 * fastutil-backed {@link LocationIdMapper}.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public class FastUtilLocationIdMapper implements LocationIdMapper {

    private static final int MISSING = -1;

    // location id -> index, primitive keys avoid boxing on the solver hot path
    private final Int2IntOpenHashMap forward;
    // index -> location id
    private final int[] reverse;

    /**
     * Builds the mapper from ids listed in index order.
     *
     * @throws IllegalArgumentException when the array is null or contains duplicates.
     */
    public FastUtilLocationIdMapper(int[] locationIdsInIndexOrder) {
        if (locationIdsInIndexOrder == null) {
            throw new IllegalArgumentException("Location ids cannot be null");
        }
        int size = locationIdsInIndexOrder.length;
        this.forward = new Int2IntOpenHashMap(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = locationIdsInIndexOrder.clone();

        for (int index = 0; index < size; index++) {
            int locationId = reverse[index];
            if (forward.containsKey(locationId)) {
                throw new IllegalArgumentException("Duplicate location id detected: " + locationId);
            }
            forward.put(locationId, index);
        }
        this.forward.trim();
    }

    @Override
    public int toIndex(int locationId) throws UnknownLocationException {
        int index = forward.get(locationId);
        if (index == MISSING) {
            throw new UnknownLocationException("Location id not found: " + locationId);
        }
        return index;
    }

    @Override
    public int toLocationId(int index) {
        try {
            return reverse[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Index out of bounds: " + index);
        }
    }

    @Override
    public boolean containsLocation(int locationId) {
        return forward.containsKey(locationId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
