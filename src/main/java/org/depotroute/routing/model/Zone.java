package org.depotroute.routing.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Geographic cluster of non-depot stops solved as one sub-tour.
 */
@Value
public class Zone {
    int zoneId;
    /** Member location ids in ascending order. Empty for a zone that attracted no stops. */
    List<Integer> memberIds;
    GeoPoint centroid;

    public Zone(int zoneId, List<Integer> memberIds, GeoPoint centroid) {
        this.zoneId = zoneId;
        List<Integer> sorted = new ArrayList<>(memberIds);
        sorted.sort(Integer::compare);
        this.memberIds = List.copyOf(sorted);
        this.centroid = centroid;
    }

    public boolean isEmpty() {
        return memberIds.isEmpty();
    }

    public int size() {
        return memberIds.size();
    }
}
