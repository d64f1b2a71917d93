package org.depotroute.core.error;

import lombok.Value;

/**
 * Non-fatal signal that an iterative stage stopped on its budget instead of converging.
 *
 * <p>The result it is attached to is the best one found before the budget ran out.
 * Callers decide whether to retry with a larger budget.</p>
 */
@Value
public class NonConvergenceWarning {
    /** Zone id used for warnings that are not tied to a single zone. */
    public static final int NO_ZONE = -1;

    public enum Stage {
        ZONE_DECOMPOSITION,
        TWO_OPT,
        ZONE_ORDERING
    }

    public enum Cause {
        ITERATION_CAP,
        TIME_BUDGET
    }

    Stage stage;
    int zoneId;
    int iterations;
    Cause cause;

    @Override
    public String toString() {
        String zone = zoneId == NO_ZONE ? "" : " zone=" + zoneId;
        return stage + zone + " stopped after " + iterations + " iterations (" + cause + ")";
    }
}
