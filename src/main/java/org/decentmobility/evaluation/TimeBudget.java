package org.decentmobility.evaluation;

import lombok.Builder;
import lombok.Value;

/**
 * Daily travel-time ceiling for decent mobility.
 */
@Value
public class TimeBudget {
    public static final double DEFAULT_HOURS_PER_DAY = 1.2d;

    private static final String PROP_HOURS_PER_DAY = "decentmobility.evaluation.dailyTimeBudgetHours";

    /** Maximum travel time [hours / day]. */
    double hoursPerDay;

    @Builder
    public TimeBudget(double hoursPerDay) {
        if (!Double.isFinite(hoursPerDay) || hoursPerDay < 0.0d) {
            throw new IllegalArgumentException("hoursPerDay must be finite and >= 0, got " + hoursPerDay);
        }
        this.hoursPerDay = hoursPerDay;
    }

    /**
     * Creates a budget with an explicit ceiling.
     */
    public static TimeBudget ofHoursPerDay(double hoursPerDay) {
        return new TimeBudget(hoursPerDay);
    }

    /**
     * Loads the budget from system properties, falling back to {@value #DEFAULT_HOURS_PER_DAY} hours.
     */
    public static TimeBudget defaults() {
        String raw = System.getProperty(PROP_HOURS_PER_DAY);
        if (raw == null || raw.isBlank()) {
            return ofHoursPerDay(DEFAULT_HOURS_PER_DAY);
        }
        try {
            return ofHoursPerDay(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(PROP_HOURS_PER_DAY + " must be numeric, got '" + raw + "'", ex);
        }
    }

    /**
     * Returns whether a daily travel time fits within this budget.
     */
    public boolean admits(double hoursPerDayTravelled) {
        return hoursPerDayTravelled <= hoursPerDay;
    }
}
