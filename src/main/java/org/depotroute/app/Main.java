package org.depotroute.app;

import org.depotroute.routing.core.OptimizationRequest;
import org.depotroute.routing.core.OptimizationResult;
import org.depotroute.routing.core.RouteOptimizationEngine;
import org.depotroute.routing.model.Location;
import org.depotroute.routing.model.RouteMetrics;

import java.time.LocalTime;
import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {
    /**
     * Optimizes a small Hyderabad sample and prints the route summary.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        try (RouteOptimizationEngine engine = new RouteOptimizationEngine()) {
            OptimizationResult result = engine.optimize(OptimizationRequest.builder()
                    .locations(sampleLocations())
                    .departure(LocalTime.of(9, 0))
                    .build());
            RouteMetrics metrics = result.getMetrics();

            System.out.println("Depot route sample");
            System.out.println("Zones: " + result.getEffectiveZones());
            System.out.println("Route: " + result.getRoute().getStopIds());
            System.out.printf("Distance: %.2f km%n", metrics.getTotalDistanceKm());
            System.out.printf("Time: %.1f min%n", metrics.getTotalTimeMinutes());
            System.out.printf("Fuel cost: %.2f%n", metrics.getFuelCost());
            System.out.printf("CO2: %.2f kg%n", metrics.getCo2Kg());
            System.out.println("Return: " + result.getSchedule().getReturnTime());
            System.out.printf("Saved vs naive: %.1f%%%n", result.getComparison().optimizedVsNaivePercent());
            if (!result.converged()) {
                System.out.println("Warnings: " + result.warnings());
            }
        }
    }

    static List<Location> sampleLocations() {
        return List.of(
                location(0, "Warehouse", 17.4485, 78.3908, "Hitech City", 0, true),
                location(1, "Customer 1", 17.4400, 78.3811, "Madhapur", 2, false),
                location(2, "Customer 2", 17.4239, 78.3460, "Gachibowli", 3, false),
                location(3, "Customer 3", 17.4609, 78.3671, "Kondapur", 1, false),
                location(4, "Customer 4", 17.4950, 78.3595, "Kukatpally", 2, false),
                location(5, "Customer 5", 17.4126, 78.4071, "Jubilee Hills", 1, false),
                location(6, "Customer 6", 17.4062, 78.4691, "Banjara Hills", 4, false),
                location(7, "Customer 7", 17.4399, 78.4983, "Secunderabad", 2, false),
                location(8, "Customer 8", 17.4849, 78.4138, "KPHB", 1, false)
        );
    }

    private static Location location(
            int id,
            String name,
            double latitude,
            double longitude,
            String locality,
            int packageCount,
            boolean depot
    ) {
        return Location.builder()
                .id(id)
                .name(name)
                .latitude(latitude)
                .longitude(longitude)
                .locality(locality)
                .packageCount(packageCount)
                .depot(depot)
                .build();
    }
}
