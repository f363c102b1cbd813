package org.decentmobility.core;

import lombok.Builder;
import org.decentmobility.evaluation.DecencyCriterion;
import org.decentmobility.evaluation.DecentMobilityEvaluator;
import org.decentmobility.evaluation.TravelPlanEvaluator;
import org.decentmobility.matching.NeedAlternativeMatcher;
import org.decentmobility.matching.NeedAlternativePair;
import org.decentmobility.model.Agent;
import org.decentmobility.persona.Person;
import org.decentmobility.persona.TravelPlan;
import org.decentmobility.selection.SelectionRequest;
import org.decentmobility.selection.SelectionResult;
import org.decentmobility.selection.TripSelector;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point wiring matcher, evaluators and trip selector.
 *
 * <p>Read path: agent -&gt; matcher -&gt; evaluator. Write path: demand + catalog -&gt;
 * selector -&gt; new plan. Every collaborator is stateless, so one instance may serve
 * concurrent callers.</p>
 */
public final class MobilityCore implements MobilityService {
    public static final String REASON_UNRESOLVED_LOCATION_ROLE = "UNRESOLVED_LOCATION_ROLE";
    public static final String REASON_NO_FEASIBLE_ALTERNATIVE = "NO_FEASIBLE_ALTERNATIVE";
    public static final String REASON_UNSUPPORTED_METHOD = "UNSUPPORTED_METHOD";
    public static final String REASON_INFEASIBLE_SELECTION = "INFEASIBLE_SELECTION";
    public static final String REASON_SELECTION_REQUEST_REQUIRED = "SELECTION_REQUEST_REQUIRED";
    public static final String REASON_INVALID_DEMAND = "INVALID_DEMAND";
    public static final String REASON_INVALID_TOLERANCE = "INVALID_TOLERANCE";
    public static final String REASON_TYPICAL_TIME_REQUIRED = "TYPICAL_TIME_REQUIRED";
    public static final String REASON_INVALID_TYPICAL_TIME = "INVALID_TYPICAL_TIME";
    public static final String REASON_STRATEGY_CONTRACT_VIOLATED = "STRATEGY_CONTRACT_VIOLATED";
    public static final String REASON_SELECTION_INTERRUPTED = "SELECTION_INTERRUPTED";
    public static final String REASON_EVALUATION_INTERRUPTED = "EVALUATION_INTERRUPTED";

    private final NeedAlternativeMatcher matcher;
    private final DecentMobilityEvaluator evaluator;
    private final TravelPlanEvaluator travelPlanEvaluator;
    private final TripSelector tripSelector;

    /**
     * Creates the facade; every collaborator is optional and defaults when null.
     *
     * @param matcher need-alternative matcher.
     * @param evaluator agent/population evaluator; the default one shares {@code matcher}.
     * @param travelPlanEvaluator time-budgeted person/plan evaluator.
     * @param tripSelector trip selector.
     */
    @Builder
    public MobilityCore(
            NeedAlternativeMatcher matcher,
            DecentMobilityEvaluator evaluator,
            TravelPlanEvaluator travelPlanEvaluator,
            TripSelector tripSelector
    ) {
        this.matcher = matcher == null ? new NeedAlternativeMatcher() : matcher;
        this.evaluator = evaluator == null
                ? new DecentMobilityEvaluator(this.matcher, DecencyCriterion.NEEDS_MATCHED)
                : evaluator;
        this.travelPlanEvaluator = travelPlanEvaluator == null ? TravelPlanEvaluator.defaults() : travelPlanEvaluator;
        this.tripSelector = tripSelector == null ? TripSelector.defaults() : tripSelector;
    }

    /**
     * Creates a facade with default collaborators.
     */
    public static MobilityCore defaults() {
        return MobilityCore.builder().build();
    }

    public DecentMobilityEvaluator evaluator() {
        return evaluator;
    }

    @Override
    public List<NeedAlternativePair> match(Agent agent) {
        return matcher.match(Objects.requireNonNull(agent, "agent"));
    }

    @Override
    public boolean isDecent(Agent agent) {
        return evaluator.isDecent(agent);
    }

    @Override
    public boolean isDecentPopulation(Collection<Agent> agents) {
        return evaluator.isDecentPopulation(agents);
    }

    @Override
    public double totalDistance(Agent agent) {
        return evaluator.totalDistance(agent);
    }

    @Override
    public boolean hasDecentMobility(Person person, TravelPlan plan) {
        return travelPlanEvaluator.hasDecentMobility(person, plan);
    }

    @Override
    public SelectionResult selectTrips(SelectionRequest request) {
        return tripSelector.select(request);
    }

    /**
     * Runs {@code request} and returns the agent with every selected alternative as its new plan.
     *
     * <p>The catalog is taken as given: alternatives are not filtered by the agent's mapped
     * locations, so callers supply a catalog whose origins fit the agent. The previous plan is
     * replaced, never merged.</p>
     */
    public Agent planAgent(Agent agent, SelectionRequest request) {
        Objects.requireNonNull(agent, "agent");
        SelectionResult result = tripSelector.select(request);
        return agent.withPlan(result.allAlternatives());
    }
}
