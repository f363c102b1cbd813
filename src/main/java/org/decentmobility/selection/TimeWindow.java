package org.decentmobility.selection;

import lombok.Value;

/**
 * Inclusive bounds on the summed travel time of one destination's selection.
 */
@Value
public class TimeWindow {
    private static final double EPSILON = 1e-9d;

    double lower;
    double upper;

    public TimeWindow(double lower, double upper) {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("time window bounds must not be NaN");
        }
        if (lower > upper) {
            throw new IllegalArgumentException("time window lower bound " + lower + " exceeds upper bound " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Builds the window for {@code count} trips whose mean time may deviate from
     * {@code typicalTime} by at most {@code tolerance}.
     *
     * <p>{@link Mode#SYMMETRIC_BAND} yields {@code [count*(typical-tolerance), count*(typical+tolerance)]}
     * with the lower bound clamped at zero; {@link Mode#UPPER_BOUND} keeps only the upper side.</p>
     */
    public static TimeWindow around(int count, double typicalTime, double tolerance, Mode mode) {
        double upper = count * (typicalTime + tolerance);
        return switch (mode) {
            case SYMMETRIC_BAND -> new TimeWindow(Math.max(0.0d, count * (typicalTime - tolerance)), upper);
            case UPPER_BOUND -> new TimeWindow(0.0d, upper);
        };
    }

    /**
     * Returns whether {@code totalTime} lies in the window, allowing floating-point slack.
     */
    public boolean contains(double totalTime) {
        return totalTime >= lower - EPSILON && totalTime <= upper + EPSILON;
    }

    /**
     * Returns whether some value in {@code [minTotal, maxTotal]} could lie in the window.
     */
    boolean overlaps(double minTotal, double maxTotal) {
        return minTotal <= upper + EPSILON && maxTotal >= lower - EPSILON;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }

    /**
     * Shape of the time constraint.
     */
    public enum Mode {
        /** Two-sided band around the typical time. */
        SYMMETRIC_BAND,
        /** One-sided: only the upper side of the band applies. */
        UPPER_BOUND
    }
}
