package org.decentmobility.persona;

import lombok.Value;

import java.util.Objects;

/**
 * Place visited by a trip, tagged with the need it satisfies.
 */
@Value
public class PointOfInterest {
    Purpose needsServed;

    public PointOfInterest(Purpose needsServed) {
        this.needsServed = Objects.requireNonNull(needsServed, "needsServed");
    }

    public static PointOfInterest serving(Purpose purpose) {
        return new PointOfInterest(purpose);
    }
}
