package org.depotroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.depotroute.routing.model.Location;

import java.time.LocalTime;
import java.util.List;

/**
 * One-shot optimization request.
 */
@Value
@Builder
public class OptimizationRequest {
    /** Location set including exactly one depot. */
    @Singular
    List<Location> locations;
    /** Departure time; its hour selects the traffic bucket for metrics. */
    @Builder.Default
    LocalTime departure = LocalTime.of(9, 0);
    /** Engine tuning; {@code null} means the engine's own configuration. */
    EngineConfig config;
}
