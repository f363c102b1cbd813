package org.decentmobility.geometry;

import org.decentmobility.model.GeoLocation;
import org.decentmobility.model.GridLocation;
import org.decentmobility.model.Location;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Immutable distance-strategy registry.
 *
 * <p>Strategies are consulted in registration order; the first one that supports an
 * origin/destination pair derives its distance. Pairs no strategy supports (for example
 * named destination categories) have no derivable distance.</p>
 */
public final class DistanceStrategyRegistry {
    public static final String STRATEGY_XY = "XY";
    public static final String STRATEGY_LAT_LON = "LAT_LON";

    private static final DistanceStrategy XY_STRATEGY = new XYDistanceStrategy();
    private static final DistanceStrategy LAT_LON_STRATEGY = new LatLonDistanceStrategy();
    private static final DistanceStrategyRegistry DEFAULT = new DistanceStrategyRegistry();

    private final Map<String, DistanceStrategy> strategyById;

    /**
     * Creates a registry with built-in XY and LAT_LON strategies.
     */
    public DistanceStrategyRegistry() {
        this(null);
    }

    /**
     * Creates a registry by merging built-ins with custom strategies.
     *
     * <p>Custom strategy ids override built-ins when ids collide.</p>
     */
    public DistanceStrategyRegistry(Collection<? extends DistanceStrategy> customStrategies) {
        LinkedHashMap<String, DistanceStrategy> merged = new LinkedHashMap<>();
        for (DistanceStrategy strategy : List.of(XY_STRATEGY, LAT_LON_STRATEGY)) {
            merged.put(strategy.id(), strategy);
        }
        if (customStrategies != null) {
            for (DistanceStrategy strategy : customStrategies) {
                DistanceStrategy nonNull = Objects.requireNonNull(strategy, "strategy");
                merged.put(normalizeId(nonNull.id()), nonNull);
            }
        }
        this.strategyById = Collections.unmodifiableMap(merged);
    }

    /**
     * Resolves strategy by id (case-sensitive), or null when missing.
     */
    public DistanceStrategy strategy(String strategyId) {
        if (strategyId == null) {
            return null;
        }
        return strategyById.get(strategyId);
    }

    /**
     * Returns immutable set of registered strategy ids in registration order.
     */
    public Set<String> strategyIds() {
        return strategyById.keySet();
    }

    /**
     * Derives the distance between two locations with the first supporting strategy.
     *
     * @return the distance, or empty when no registered strategy supports the pair.
     */
    public OptionalDouble distance(Location origin, Location destination) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        for (DistanceStrategy strategy : strategyById.values()) {
            if (strategy.supports(origin, destination)) {
                return OptionalDouble.of(strategy.distance(origin, destination));
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Returns the shared default registry.
     */
    public static DistanceStrategyRegistry defaultRegistry() {
        return DEFAULT;
    }

    private static String normalizeId(String id) {
        String normalized = Objects.requireNonNull(id, "id").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("strategy id must be non-blank");
        }
        return normalized;
    }

    private static final class XYDistanceStrategy implements DistanceStrategy {
        @Override
        public String id() {
            return STRATEGY_XY;
        }

        @Override
        public boolean supports(Location origin, Location destination) {
            return origin instanceof GridLocation && destination instanceof GridLocation;
        }

        @Override
        public double distance(Location origin, Location destination) {
            if (!supports(origin, destination)) {
                throw new IllegalArgumentException("XY strategy requires two grid locations");
            }
            return ((GridLocation) origin).distanceTo((GridLocation) destination);
        }
    }

    private static final class LatLonDistanceStrategy implements DistanceStrategy {
        @Override
        public String id() {
            return STRATEGY_LAT_LON;
        }

        @Override
        public boolean supports(Location origin, Location destination) {
            return origin instanceof GeoLocation && destination instanceof GeoLocation;
        }

        @Override
        public double distance(Location origin, Location destination) {
            if (!supports(origin, destination)) {
                throw new IllegalArgumentException("LAT_LON strategy requires two geographic locations");
            }
            return ((GeoLocation) origin).distanceTo((GeoLocation) destination);
        }
    }
}
