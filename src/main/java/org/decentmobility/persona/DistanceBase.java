package org.decentmobility.persona;

/**
 * Time base for reporting the travel distance of a plan.
 */
public enum DistanceBase {
    /** Total distance over the covered period. */
    TOTAL,
    /** Distance per day of the covered period. */
    DAY,
    /** Distance extrapolated to a 365-day year. */
    YEAR
}
