package org.decentmobility.persona;

import lombok.Value;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reporting helpers over travel plans.
 */
@UtilityClass
public final class TravelPlans {
    private static final double DAYS_PER_YEAR = 365.0d;

    /**
     * Sums trip distances of {@code plan} [kilometre per base period].
     */
    public static double travelDistance(TravelPlan plan, DistanceBase base) {
        double total = 0.0d;
        for (Trip trip : Objects.requireNonNull(plan, "plan").getTrips()) {
            total += trip.getDistance();
        }
        return switch (Objects.requireNonNull(base, "base")) {
            case TOTAL -> total;
            case DAY -> total / plan.getPeriodCoveredDays();
            case YEAR -> total * DAYS_PER_YEAR / plan.getPeriodCoveredDays();
        };
    }

    /**
     * Sums trip durations of {@code plan} [hours].
     */
    public static double travelTime(TravelPlan plan) {
        double total = 0.0d;
        for (Trip trip : Objects.requireNonNull(plan, "plan").getTrips()) {
            total += trip.getTime();
        }
        return total;
    }

    /**
     * Counts trips of {@code plan} whose destination serves {@code purpose}.
     */
    public static int tripCount(TravelPlan plan, Purpose purpose) {
        Objects.requireNonNull(purpose, "purpose");
        int count = 0;
        for (Trip trip : Objects.requireNonNull(plan, "plan").getTrips()) {
            if (trip.purpose() == purpose) {
                count++;
            }
        }
        return count;
    }

    /**
     * Builds a one-week plan of identical trips per purpose from aggregate values.
     *
     * <p>Each aggregate is treated as the average trip for its purpose; the plan holds
     * {@code count} copies of it.</p>
     */
    public static TravelPlan fromAggregates(Map<Purpose, TripAggregate> aggregates) {
        List<Trip> trips = new ArrayList<>();
        for (Map.Entry<Purpose, TripAggregate> entry : Objects.requireNonNull(aggregates, "aggregates").entrySet()) {
            TripAggregate aggregate = Objects.requireNonNull(entry.getValue(), "aggregate");
            Trip trip = new Trip(aggregate.getDistance(), aggregate.getTime(), PointOfInterest.serving(entry.getKey()));
            for (int i = 0; i < aggregate.getCount(); i++) {
                trips.add(trip);
            }
        }
        return TravelPlan.ofWeek(trips);
    }

    /**
     * Average trip for one purpose: number of trips, distance [km] and duration [hours].
     */
    @Value
    public static class TripAggregate {
        int count;
        double distance;
        double time;

        public TripAggregate(int count, double distance, double time) {
            if (count < 0) {
                throw new IllegalArgumentException("aggregate count must be >= 0, got " + count);
            }
            this.count = count;
            this.distance = distance;
            this.time = time;
        }

        public static TripAggregate of(int count, double distance, double time) {
            return new TripAggregate(count, distance, time);
        }
    }
}
