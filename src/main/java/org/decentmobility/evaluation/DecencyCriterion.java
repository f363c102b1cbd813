package org.decentmobility.evaluation;

/**
 * Strictness level of the per-agent decent-mobility predicate.
 *
 * <p>{@code NEEDS_MATCHED} requires every need with a positive count to have an alternative
 * sharing its resolved origin/destination.</p>
 * <p>{@code PLAN_SIZE} only requires the plan to hold at least as many alternatives as the
 * agent has needs with a positive count, ignoring where they go.</p>
 */
public enum DecencyCriterion {
    NEEDS_MATCHED,
    PLAN_SIZE
}
