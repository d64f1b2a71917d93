package org.depotroute.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouteEngineExceptionTest {

    @Test
    @DisplayName("Message: reason code is prefixed")
    void testMessagePrefix() {
        ValidationException ex = new ValidationException(ValidationException.REASON_DEPOT_COUNT, "no depot");
        assertEquals("[DEPOT_COUNT] no depot", ex.getMessage());
        assertEquals(ValidationException.REASON_DEPOT_COUNT, ex.getReasonCode());
        assertEquals("no depot", ex.getDetail());
        assertInstanceOf(RouteEngineException.class, ex);
    }

    @Test
    @DisplayName("Cause: underlying failure is retained")
    void testCauseRetained() {
        IllegalStateException cause = new IllegalStateException("boom");
        RouteEngineException ex = new RouteEngineException(
                RouteEngineException.REASON_ZONE_SOLVE_FAILED, "failed", cause);
        assertSame(cause, ex.getCause());
        assertEquals("[ZONE_SOLVE_FAILED] failed", ex.getMessage());
        assertEquals("failed", ex.getDetail());
    }

    @Test
    @DisplayName("Validation: blank reason codes are rejected")
    void testBlankReasonRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RouteEngineException(" ", "x"));
        assertThrows(NullPointerException.class, () -> new RouteEngineException(null, "x"));
        assertThrows(NullPointerException.class, () -> new RouteEngineException("CODE", null));
    }

    @Test
    @DisplayName("Warning: readable summary names stage, zone and cause")
    void testWarningToString() {
        NonConvergenceWarning zoneWarning = new NonConvergenceWarning(
                NonConvergenceWarning.Stage.TWO_OPT, 2, 5, NonConvergenceWarning.Cause.ITERATION_CAP);
        assertTrue(zoneWarning.toString().contains("zone=2"));
        assertTrue(zoneWarning.toString().contains("ITERATION_CAP"));

        NonConvergenceWarning global = new NonConvergenceWarning(
                NonConvergenceWarning.Stage.ZONE_DECOMPOSITION, NonConvergenceWarning.NO_ZONE, 1,
                NonConvergenceWarning.Cause.TIME_BUDGET);
        assertEquals("ZONE_DECOMPOSITION stopped after 1 iterations (TIME_BUDGET)", global.toString());
    }
}
