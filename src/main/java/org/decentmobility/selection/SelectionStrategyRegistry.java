package org.decentmobility.selection;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry resolving selection method ids and aliases to strategies.
 */
public final class SelectionStrategyRegistry {
    private static final SelectionStrategy UNIFORM_RANDOM_STRATEGY = new UniformRandomSelectionStrategy();
    private static final SelectionStrategy MIN_ENERGY_STRATEGY = new MinEnergySelectionStrategy();

    private final Map<String, SelectionStrategy> strategiesById;
    private final Map<String, SelectionStrategy> strategiesByAlias;

    /**
     * Creates a registry with built-in strategies only.
     */
    public SelectionStrategyRegistry() {
        this(null);
    }

    /**
     * Creates a registry by merging built-ins with custom strategies.
     *
     * <p>Custom strategy ids override built-ins when ids collide.</p>
     */
    public SelectionStrategyRegistry(Collection<? extends SelectionStrategy> customStrategies) {
        LinkedHashMap<String, SelectionStrategy> byId = new LinkedHashMap<>();
        for (SelectionStrategy strategy : defaultStrategies()) {
            byId.put(strategy.id(), strategy);
        }
        if (customStrategies != null) {
            for (SelectionStrategy strategy : customStrategies) {
                SelectionStrategy nonNull = Objects.requireNonNull(strategy, "strategy");
                byId.put(normalizeRequiredId(nonNull.id(), "strategy.id"), nonNull);
            }
        }

        LinkedHashMap<String, SelectionStrategy> byAlias = new LinkedHashMap<>();
        for (SelectionStrategy strategy : byId.values()) {
            for (String alias : strategy.aliases()) {
                String normalized = normalizeRequiredId(alias, "strategy.alias");
                if (!byId.containsKey(normalized)) {
                    byAlias.put(normalized, strategy);
                }
            }
        }
        this.strategiesById = Map.copyOf(byId);
        this.strategiesByAlias = Map.copyOf(byAlias);
    }

    /**
     * Resolves a strategy by id or alias (case-sensitive, surrounding whitespace ignored),
     * or null when not registered.
     */
    public SelectionStrategy strategy(String methodId) {
        if (methodId == null) {
            return null;
        }
        String normalized = methodId.trim();
        SelectionStrategy strategy = strategiesById.get(normalized);
        if (strategy != null) {
            return strategy;
        }
        return strategiesByAlias.get(normalized);
    }

    /**
     * Returns immutable set of registered primary strategy ids.
     */
    public Set<String> strategyIds() {
        return strategiesById.keySet();
    }

    /**
     * Returns a new default registry instance.
     */
    public static SelectionStrategyRegistry defaultRegistry() {
        return new SelectionStrategyRegistry();
    }

    private static Collection<? extends SelectionStrategy> defaultStrategies() {
        return List.of(UNIFORM_RANDOM_STRATEGY, MIN_ENERGY_STRATEGY);
    }

    private static String normalizeRequiredId(String id, String fieldName) {
        String normalized = Objects.requireNonNull(id, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }
}
