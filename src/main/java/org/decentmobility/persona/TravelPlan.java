package org.decentmobility.persona;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Concrete, time-bounded collection of trips attributed to a person.
 *
 * <p>Plans are immutable; recomputation produces a new plan.</p>
 */
@Value
public class TravelPlan {
    public static final int DEFAULT_PERIOD_DAYS = 7;

    /** Duration of the period covered by the plan [days]. */
    int periodCoveredDays;
    /** Trips that constitute the plan. */
    List<Trip> trips;

    public TravelPlan(int periodCoveredDays, List<Trip> trips) {
        if (periodCoveredDays <= 0) {
            throw new IllegalArgumentException("periodCoveredDays must be > 0, got " + periodCoveredDays);
        }
        this.periodCoveredDays = periodCoveredDays;
        this.trips = List.copyOf(Objects.requireNonNull(trips, "trips"));
    }

    /**
     * Creates a one-week plan.
     */
    public static TravelPlan ofWeek(List<Trip> trips) {
        return new TravelPlan(DEFAULT_PERIOD_DAYS, trips);
    }

    /**
     * Creates an empty one-week plan.
     */
    public static TravelPlan empty() {
        return ofWeek(List.of());
    }

    @Override
    public String toString() {
        return "<Travel plan with " + trips.size() + " trips in " + periodCoveredDays + " days>";
    }
}
