package org.decentmobility.model;

import lombok.Builder;
import lombok.Value;
import org.decentmobility.geometry.DistanceStrategyRegistry;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Specific, mode-bound way of making a trip between two resolved locations.
 *
 * <p>{@code distance} is derived once at construction when a registered distance
 * strategy supports the origin/destination pair (two grid or two geographic locations);
 * the supplied value is then ignored. For other pairs the supplied distance is kept.
 * All numeric attributes are finite and non-negative.</p>
 */
@Value
public class Alternative {
    /** Concrete trip origin. */
    Location origin;
    /** Concrete trip destination. */
    Location destination;
    /** Transport mode tag, for example {@code "bus"}. */
    String mode;
    /** Monetary cost of one trip. */
    double cost;
    /** Distance of one trip. */
    double distance;
    /** Final energy demand of one trip. */
    double energy;
    /** Travel time of one trip. */
    double time;

    /**
     * Creates an alternative, deriving {@code distance} where the geometry allows it.
     *
     * @param distanceStrategies optional registry override; the default registry is used when null.
     */
    @Builder
    private Alternative(
            Location origin,
            Location destination,
            String mode,
            double cost,
            double distance,
            double energy,
            double time,
            DistanceStrategyRegistry distanceStrategies
    ) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.mode = requireMode(mode);
        this.cost = requireNonNegative(cost, "cost");
        this.energy = requireNonNegative(energy, "energy");
        this.time = requireNonNegative(time, "time");

        DistanceStrategyRegistry registry = distanceStrategies == null
                ? DistanceStrategyRegistry.defaultRegistry()
                : distanceStrategies;
        OptionalDouble derived = registry.distance(origin, destination);
        this.distance = requireNonNegative(derived.isPresent() ? derived.getAsDouble() : distance, "distance");
    }

    /**
     * Creates an alternative with zero cost, energy and time.
     */
    public static Alternative of(Location origin, Location destination, String mode) {
        return Alternative.builder()
                .origin(origin)
                .destination(destination)
                .mode(mode)
                .build();
    }

    private static String requireMode(String mode) {
        String normalized = Objects.requireNonNull(mode, "mode").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("mode must be non-blank");
        }
        return normalized;
    }

    private static double requireNonNegative(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(fieldName + " must be finite and >= 0, got " + value);
        }
        return value;
    }
}
