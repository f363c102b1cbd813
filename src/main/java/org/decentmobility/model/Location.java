package org.decentmobility.model;

/**
 * Concrete place an alternative starts or ends at.
 *
 * <p>Implementations are immutable value objects with structural equality. Distances
 * between locations are derived by {@link org.decentmobility.geometry.DistanceStrategyRegistry};
 * representations without a registered strategy carry externally supplied distances.</p>
 */
public interface Location {
}
