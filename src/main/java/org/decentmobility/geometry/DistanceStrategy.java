package org.decentmobility.geometry;

import org.decentmobility.model.Location;

/**
 * Distance provider for one family of location representations.
 *
 * <p>Implementations must be pure: symmetric, non-negative, and zero for coincident
 * locations.</p>
 */
public interface DistanceStrategy {
    /**
     * Stable strategy id used for registry lookups and overrides.
     */
    String id();

    /**
     * Returns whether this strategy can measure the given origin/destination pair.
     */
    boolean supports(Location origin, Location destination);

    /**
     * Computes the distance between two supported locations.
     *
     * @throws IllegalArgumentException when the pair is not supported.
     */
    double distance(Location origin, Location destination);
}
