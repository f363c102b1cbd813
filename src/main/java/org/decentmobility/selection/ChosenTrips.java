package org.decentmobility.selection;

import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stored selection of a demand profile, one list of alternatives per destination.
 *
 * <p>Applying a result overwrites the lists of the destinations it contains and leaves
 * every other destination untouched. Instances are thread-safe.</p>
 */
public final class ChosenTrips {
    private final Map<Location, List<Alternative>> trips = new LinkedHashMap<>();

    public ChosenTrips(Collection<Location> destinations) {
        for (Location destination : Objects.requireNonNull(destinations, "destinations")) {
            trips.put(Objects.requireNonNull(destination, "destination"), List.of());
        }
    }

    /**
     * Creates an empty store with one entry per destination of {@code demand}.
     */
    public static ChosenTrips forDemand(TripDemand demand) {
        return new ChosenTrips(Objects.requireNonNull(demand, "demand").getDemand().keySet());
    }

    /**
     * Replaces the stored alternatives of every destination present in {@code result}.
     */
    public synchronized void apply(SelectionResult result) {
        for (Map.Entry<Location, List<Alternative>> entry : Objects.requireNonNull(result, "result").getChosen().entrySet()) {
            trips.put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Returns the stored alternatives for one destination, empty when none are stored.
     */
    public synchronized List<Alternative> trips(Location destination) {
        return trips.getOrDefault(destination, List.of());
    }

    /**
     * Returns an immutable snapshot of all stored selections.
     */
    public synchronized Map<Location, List<Alternative>> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(trips));
    }
}
