package org.depotroute.core.budget;

import org.depotroute.core.error.NonConvergenceWarning;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Per-solve bounds on iterative work: an iteration cap plus an optional wall-clock budget.
 *
 * <p>Loops consult the budget between iterations. Exhaustion is not an error; the loop
 * stops, keeps its best result and reports the {@link NonConvergenceWarning.Cause}.
 * Instances are immutable and may be shared by concurrent zone solves, which then
 * share one deadline.</p>
 */
public final class SolveBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    private static final long NO_TIME_LIMIT = Long.MAX_VALUE;

    private final int maxIterations;
    private final long startNanos;
    private final long timeBudgetNanos;
    private final LongSupplier nanoClock;

    private SolveBudget(int maxIterations, long startNanos, long timeBudgetNanos, LongSupplier nanoClock) {
        this.maxIterations = normalizeBound(maxIterations);
        this.startNanos = startNanos;
        this.timeBudgetNanos = timeBudgetNanos;
        this.nanoClock = nanoClock;
    }

    /**
     * Creates an iteration-only budget. Non-positive caps mean unbounded.
     */
    public static SolveBudget of(int maxIterations) {
        return new SolveBudget(maxIterations, 0L, NO_TIME_LIMIT, System::nanoTime);
    }

    /**
     * Creates a budget whose clock starts now. A null, zero or negative duration means no time limit.
     */
    public static SolveBudget of(int maxIterations, Duration timeBudget) {
        return of(maxIterations, timeBudget, System::nanoTime);
    }

    /**
     * Creates a budget against an explicit monotonic nanosecond clock.
     */
    public static SolveBudget of(int maxIterations, Duration timeBudget, LongSupplier nanoClock) {
        Objects.requireNonNull(nanoClock, "nanoClock");
        long budgetNanos = timeBudget == null || timeBudget.isZero() || timeBudget.isNegative()
                ? NO_TIME_LIMIT
                : saturatedNanos(timeBudget);
        return new SolveBudget(maxIterations, nanoClock.getAsLong(), budgetNanos, nanoClock);
    }

    /**
     * Budget with no caps.
     */
    public static SolveBudget unbounded() {
        return of(UNBOUNDED);
    }

    /**
     * Returns a budget with a different iteration cap that shares this budget's deadline.
     */
    public SolveBudget withMaxIterations(int maxIterations) {
        return new SolveBudget(maxIterations, startNanos, timeBudgetNanos, nanoClock);
    }

    public int maxIterations() {
        return maxIterations;
    }

    /**
     * Returns why work must stop after {@code completedIterations}, or {@code null} to continue.
     */
    public NonConvergenceWarning.Cause check(int completedIterations) {
        if (completedIterations >= maxIterations) {
            return NonConvergenceWarning.Cause.ITERATION_CAP;
        }
        if (timeExpired()) {
            return NonConvergenceWarning.Cause.TIME_BUDGET;
        }
        return null;
    }

    /**
     * Whether the wall-clock budget is spent.
     */
    public boolean timeExpired() {
        if (timeBudgetNanos == NO_TIME_LIMIT) {
            return false;
        }
        return nanoClock.getAsLong() - startNanos >= timeBudgetNanos;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException ex) {
            return NO_TIME_LIMIT;
        }
    }
}
