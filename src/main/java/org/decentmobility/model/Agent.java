package org.decentmobility.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Agent representing an individual, a persona, or a representative member of a population.
 *
 * <p>The plan is the agent's realized set of trips. It may be empty, under-specified
 * or fully matched against the needs. Agents are immutable: {@link #withPlan(List)}
 * returns a new agent whose plan replaces the current one.</p>
 */
@Value
public class Agent {
    /** Concrete location per role, unique per role. */
    Map<LocationRole, Location> locations;
    /** Trip needs in declaration order. */
    List<Need> needs;
    /** Realized alternatives in plan order. */
    List<Alternative> plan;

    @Builder(toBuilder = true)
    public Agent(
            @Singular("location") Map<LocationRole, Location> locations,
            @Singular List<Need> needs,
            @Singular("planned") List<Alternative> plan
    ) {
        EnumMap<LocationRole, Location> byRole = new EnumMap<>(LocationRole.class);
        if (locations != null) {
            for (Map.Entry<LocationRole, Location> entry : locations.entrySet()) {
                byRole.put(
                        Objects.requireNonNull(entry.getKey(), "location role"),
                        Objects.requireNonNull(entry.getValue(), "location for " + entry.getKey())
                );
            }
        }
        this.locations = Collections.unmodifiableMap(byRole);
        this.needs = copyNonNull(needs, "need");
        this.plan = copyNonNull(plan, "alternative");
    }

    /**
     * Returns the location bound to one role, or empty when the role is unmapped.
     */
    public Optional<Location> location(LocationRole role) {
        return Optional.ofNullable(locations.get(role));
    }

    /**
     * Returns a copy of this agent whose plan is replaced by {@code newPlan}.
     */
    public Agent withPlan(List<Alternative> newPlan) {
        return new Agent(locations, needs, Objects.requireNonNull(newPlan, "newPlan"));
    }

    private static <T> List<T> copyNonNull(List<T> source, String elementName) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(source.size());
        for (T element : source) {
            copy.add(Objects.requireNonNull(element, elementName));
        }
        return Collections.unmodifiableList(copy);
    }
}
