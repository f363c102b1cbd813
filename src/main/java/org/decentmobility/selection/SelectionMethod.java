package org.decentmobility.selection;

import java.util.Set;

/**
 * Built-in selection methods with their stable ids.
 *
 * <p>{@code UNIFORM_RANDOM} draws alternatives uniformly with replacement.</p>
 * <p>{@code MIN_ENERGY_WITHIN_TIME_BUDGET} minimizes summed energy subject to summed travel
 * time lying in a window anchored to the typical travel time.</p>
 * <p>Legacy ids ({@code random}, {@code min_energy_typ_time}) are accepted as aliases.</p>
 */
public enum SelectionMethod {
    UNIFORM_RANDOM("uniform-random", "random"),
    MIN_ENERGY_WITHIN_TIME_BUDGET("min-energy-within-time-budget", "min_energy_typ_time");

    private final String id;
    private final Set<String> aliases;

    SelectionMethod(String id, String... aliases) {
        this.id = id;
        this.aliases = Set.of(aliases);
    }

    /**
     * Stable method id used in selection requests.
     */
    public String id() {
        return id;
    }

    /**
     * Alternate ids resolving to the same method.
     */
    public Set<String> aliases() {
        return aliases;
    }
}
