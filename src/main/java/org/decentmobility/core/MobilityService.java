package org.decentmobility.core;

import org.decentmobility.matching.NeedAlternativePair;
import org.decentmobility.model.Agent;
import org.decentmobility.persona.Person;
import org.decentmobility.persona.TravelPlan;
import org.decentmobility.selection.SelectionRequest;
import org.decentmobility.selection.SelectionResult;

import java.util.Collection;
import java.util.List;

/**
 * Public matching, evaluation and selection contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw reason-coded {@link MobilityCoreException}s for contract failures.</p>
 */
public interface MobilityService {
    /**
     * Pairs the agent's needs with its planned alternatives by resolved origin/destination.
     */
    List<NeedAlternativePair> match(Agent agent);

    /**
     * Returns true if the agent's plan gives it decent mobility.
     */
    boolean isDecent(Agent agent);

    /**
     * Returns true if every agent has decent mobility.
     */
    boolean isDecentPopulation(Collection<Agent> agents);

    /**
     * Returns the need-weighted distance of the agent's matched alternatives.
     */
    double totalDistance(Agent agent);

    /**
     * Returns true if the travel plan gives the person decent mobility within the daily time budget.
     */
    boolean hasDecentMobility(Person person, TravelPlan plan);

    /**
     * Selects alternatives per destination to satisfy the requested demand.
     */
    SelectionResult selectTrips(SelectionRequest request);
}
