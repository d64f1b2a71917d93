package org.depotroute.routing.model;

import lombok.Value;

/**
 * Plain (latitude, longitude) pair, used for zone centroids.
 */
@Value
public class GeoPoint {
    double latitude;
    double longitude;
}
