package org.decentmobility.selection;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.concurrent.TimeUnit;

/**
 * Per-destination bounds for optimization search work and wall-clock time.
 *
 * <p>Exhausting either bound is reported as an infeasible selection.</p>
 */
public final class SelectionBudget {
    static final long UNBOUNDED = Long.MAX_VALUE;
    public static final long DEFAULT_MAX_SEARCH_NODES = 5_000_000L;

    static final String REASON_SEARCH_NODES_EXCEEDED = "SELECTION_BUDGET_SEARCH_NODES_EXCEEDED";
    static final String REASON_SOLVE_TIME_EXCEEDED = "SELECTION_BUDGET_SOLVE_TIME_EXCEEDED";

    private static final String PROP_MAX_SEARCH_NODES = "decentmobility.selection.maxSearchNodes";
    private static final String PROP_MAX_SOLVE_MILLIS = "decentmobility.selection.maxSolveMillis";

    private final long maxSearchNodes;
    private final long maxSolveNanos;

    private SelectionBudget(long maxSearchNodes, long maxSolveMillis) {
        this.maxSearchNodes = normalizeBound(maxSearchNodes);
        // toNanos saturates at Long.MAX_VALUE, which is UNBOUNDED
        this.maxSolveNanos = TimeUnit.MILLISECONDS.toNanos(normalizeBound(maxSolveMillis));
    }

    /**
     * Creates a budget with explicit bounds; non-positive values mean unbounded.
     */
    public static SelectionBudget of(long maxSearchNodes, long maxSolveMillis) {
        return new SelectionBudget(maxSearchNodes, maxSolveMillis);
    }

    /**
     * Returns a budget without bounds.
     */
    public static SelectionBudget unbounded() {
        return new SelectionBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties.
     *
     * <p>Search nodes default to {@value #DEFAULT_MAX_SEARCH_NODES}; solve time defaults to
     * unbounded. A non-positive property value removes the bound.</p>
     */
    public static SelectionBudget defaults() {
        return SelectionBudget.of(
                readBound(PROP_MAX_SEARCH_NODES, DEFAULT_MAX_SEARCH_NODES),
                readBound(PROP_MAX_SOLVE_MILLIS, UNBOUNDED)
        );
    }

    /**
     * Validates explored search nodes against the configured bound.
     */
    void checkSearchNodes(long searchNodes) {
        if (searchNodes > maxSearchNodes) {
            throw new BudgetExceededException(
                    REASON_SEARCH_NODES_EXCEEDED,
                    "search-node budget exceeded: " + searchNodes + " > " + maxSearchNodes
            );
        }
    }

    /**
     * Validates elapsed solve time against the configured bound.
     */
    void checkElapsed(long startNanos) {
        if (maxSolveNanos == UNBOUNDED) {
            return;
        }
        long elapsed = System.nanoTime() - startNanos;
        if (elapsed > maxSolveNanos) {
            throw new BudgetExceededException(
                    REASON_SOLVE_TIME_EXCEEDED,
                    "solve-time budget exceeded: " + (elapsed / 1_000_000L) + "ms > " + (maxSolveNanos / 1_000_000L) + "ms"
            );
        }
    }

    private static long normalizeBound(long bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long readBound(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(property + " must be an integer, got '" + raw + "'", ex);
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
