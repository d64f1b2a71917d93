package org.depotroute.routing.metrics;

import lombok.Value;

/**
 * Distances of the three reference routes and the savings between them.
 */
@Value
public class RouteComparison {
    double naiveKm;
    double nearestNeighborKm;
    double optimizedKm;

    public double nearestNeighborVsNaiveKmSaved() {
        return naiveKm - nearestNeighborKm;
    }

    public double nearestNeighborVsNaivePercent() {
        return percent(naiveKm, nearestNeighborKm);
    }

    public double optimizedVsNaiveKmSaved() {
        return naiveKm - optimizedKm;
    }

    public double optimizedVsNaivePercent() {
        return percent(naiveKm, optimizedKm);
    }

    public double optimizedVsNearestNeighborKmSaved() {
        return nearestNeighborKm - optimizedKm;
    }

    public double optimizedVsNearestNeighborPercent() {
        return percent(nearestNeighborKm, optimizedKm);
    }

    private static double percent(double baseKm, double improvedKm) {
        if (baseKm == 0.0d) {
            return 0.0d;
        }
        return (baseKm - improvedKm) / baseKm * 100.0d;
    }
}
