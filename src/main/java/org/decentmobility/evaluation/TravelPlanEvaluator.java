package org.decentmobility.evaluation;

import org.decentmobility.persona.Person;
import org.decentmobility.persona.Purpose;
import org.decentmobility.persona.TravelPlan;
import org.decentmobility.persona.TravelPlans;

import java.util.Objects;

/**
 * Time-budgeted decent-mobility predicate over a person's travel plan.
 *
 * <p>A plan provides decent mobility when both hold:</p>
 * <ol>
 * <li>for every {@link Purpose}, the plan has at least as many trips serving it as the
 * person needs;</li>
 * <li>total travel time divided by the covered period does not exceed the daily
 * {@link TimeBudget}.</li>
 * </ol>
 */
public final class TravelPlanEvaluator {
    private final TimeBudget timeBudget;

    public TravelPlanEvaluator(TimeBudget timeBudget) {
        this.timeBudget = Objects.requireNonNull(timeBudget, "timeBudget");
    }

    /**
     * Creates an evaluator bound to {@link TimeBudget#defaults()}.
     */
    public static TravelPlanEvaluator defaults() {
        return new TravelPlanEvaluator(TimeBudget.defaults());
    }

    public TimeBudget timeBudget() {
        return timeBudget;
    }

    /**
     * Returns true if {@code plan} provides decent mobility for {@code person}.
     */
    public boolean hasDecentMobility(Person person, TravelPlan plan) {
        return meetsTripNeeds(person, plan) && withinTimeBudget(plan);
    }

    /**
     * Returns true when every purpose has at least the person's needed trip count.
     */
    public boolean meetsTripNeeds(Person person, TravelPlan plan) {
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(plan, "plan");
        for (Purpose purpose : Purpose.values()) {
            if (TravelPlans.tripCount(plan, purpose) < person.tripNeed(purpose)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true when the plan's daily travel time fits the budget.
     */
    public boolean withinTimeBudget(TravelPlan plan) {
        return timeBudget.admits(dailyTravelTime(plan));
    }

    /**
     * Returns travel time per day of the covered period [hours / day].
     */
    public static double dailyTravelTime(TravelPlan plan) {
        return TravelPlans.travelTime(plan) / Objects.requireNonNull(plan, "plan").getPeriodCoveredDays();
    }
}
