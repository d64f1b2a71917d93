package org.depotroute.routing.zone;

import lombok.Value;
import org.depotroute.core.error.NonConvergenceWarning;
import org.depotroute.routing.model.Zone;

import java.util.List;

/**
 * Result of one zone decomposition run.
 */
@Value
public class ZoneDecomposition {
    /** Exactly k zones, indexed by zone id. */
    List<Zone> zones;
    /** Assignment iterations performed. */
    int iterations;
    /** Present when the run stopped on its budget; {@code null} when it converged. */
    NonConvergenceWarning warning;

    public ZoneDecomposition(List<Zone> zones, int iterations, NonConvergenceWarning warning) {
        this.zones = List.copyOf(zones);
        this.iterations = iterations;
        this.warning = warning;
    }

    public boolean converged() {
        return warning == null;
    }
}
