package org.decentmobility.model;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of agents evaluated together.
 */
@Value
public class Population {
    List<Agent> agents;

    public Population(List<Agent> agents) {
        this.agents = List.copyOf(Objects.requireNonNull(agents, "agents"));
    }

    /**
     * Creates a population from the given agents.
     */
    public static Population of(Agent... agents) {
        return new Population(List.of(agents));
    }

    /**
     * Returns the number of agents.
     */
    public int size() {
        return agents.size();
    }
}
