package org.decentmobility.matching;

import lombok.Value;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.Objects;

/**
 * Resolved origin/destination pair used as matching key.
 */
@Value
public class ODKey {
    Location origin;
    Location destination;

    public ODKey(Location origin, Location destination) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    /**
     * Returns the key of one alternative.
     */
    public static ODKey of(Alternative alternative) {
        return new ODKey(alternative.getOrigin(), alternative.getDestination());
    }
}
