package org.depotroute.routing.model;

import lombok.Builder;
import lombok.Value;

/**
 * One resolved stop supplied by the caller's loader.
 *
 * <p>Exactly one location in a set is the depot. The engine treats locations as
 * read-only.</p>
 */
@Value
@Builder
public class Location {
    /** Unique, stable location id. */
    int id;
    /** Display name (customer or warehouse). */
    String name;
    /** Latitude in degrees, [-90, 90]. */
    double latitude;
    /** Longitude in degrees, [-180, 180]. */
    double longitude;
    /** Neighborhood label used by reporting collaborators. */
    String locality;
    /** Packages to drop at this stop, >= 0. */
    int packageCount;
    /** Whether this location is the depot (route start and end). */
    boolean depot;
}
