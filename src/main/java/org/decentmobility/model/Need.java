package org.decentmobility.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Declared requirement for a number of trips of one purpose between two location roles.
 *
 * <p>Needs never reference concrete locations; they are resolved through the owning
 * agent's role mapping at match time.</p>
 */
@Value
public class Need {
    /** Purpose the trips serve. */
    TripPurpose purpose;
    /** Role of the trip origin. */
    LocationRole origin;
    /** Role of the trip destination. */
    LocationRole destination;
    /** Number of trips required in a typical week. Zero-count needs are vacuously satisfied. */
    int count;

    @Builder
    public Need(TripPurpose purpose, LocationRole origin, LocationRole destination, int count) {
        this.purpose = Objects.requireNonNull(purpose, "purpose");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.destination = Objects.requireNonNull(destination, "destination");
        if (count < 0) {
            throw new IllegalArgumentException("need count must be >= 0, got " + count);
        }
        this.count = count;
    }

    /**
     * Creates a need.
     */
    public static Need of(TripPurpose purpose, LocationRole origin, LocationRole destination, int count) {
        return new Need(purpose, origin, destination, count);
    }
}
