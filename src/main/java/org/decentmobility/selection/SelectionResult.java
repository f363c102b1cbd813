package org.decentmobility.selection;

import lombok.Value;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Chosen alternatives per destination, in request demand order.
 */
@Value
public class SelectionResult {
    /** Id of the strategy that produced the selection. */
    String method;
    /** Chosen alternatives per destination; zero-demand destinations map to an empty list. */
    Map<Location, List<Alternative>> chosen;

    public SelectionResult(String method, Map<Location, List<Alternative>> chosen) {
        this.method = Objects.requireNonNull(method, "method");
        LinkedHashMap<Location, List<Alternative>> copy = new LinkedHashMap<>();
        for (Map.Entry<Location, List<Alternative>> entry : Objects.requireNonNull(chosen, "chosen").entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.chosen = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the alternatives chosen for one destination, empty when it was not requested.
     */
    public List<Alternative> alternatives(Location destination) {
        return chosen.getOrDefault(destination, List.of());
    }

    /**
     * Returns requested destinations in demand order.
     */
    public Set<Location> destinations() {
        return chosen.keySet();
    }

    /**
     * Returns every chosen alternative, destinations in demand order.
     */
    public List<Alternative> allAlternatives() {
        List<Alternative> all = new ArrayList<>();
        for (List<Alternative> alternatives : chosen.values()) {
            all.addAll(alternatives);
        }
        return Collections.unmodifiableList(all);
    }

    /**
     * Sums energy over all chosen alternatives.
     */
    public double totalEnergy() {
        double total = 0.0d;
        for (Alternative alternative : allAlternatives()) {
            total += alternative.getEnergy();
        }
        return total;
    }

    /**
     * Sums travel time over all chosen alternatives.
     */
    public double totalTime() {
        double total = 0.0d;
        for (Alternative alternative : allAlternatives()) {
            total += alternative.getTime();
        }
        return total;
    }
}
