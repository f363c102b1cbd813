package org.decentmobility.persona;

import lombok.Value;

import java.util.Objects;

/**
 * Single realized trip of a travel plan.
 */
@Value
public class Trip {
    /** Distance travelled [kilometre]. */
    double distance;
    /** Duration of the trip [hours]. */
    double time;
    /** Place visited. */
    PointOfInterest destination;

    public Trip(double distance, double time, PointOfInterest destination) {
        if (!Double.isFinite(distance) || distance < 0.0d) {
            throw new IllegalArgumentException("trip distance must be finite and >= 0, got " + distance);
        }
        if (!Double.isFinite(time) || time < 0.0d) {
            throw new IllegalArgumentException("trip time must be finite and >= 0, got " + time);
        }
        this.distance = distance;
        this.time = time;
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    /**
     * Returns the purpose served by this trip's destination.
     */
    public Purpose purpose() {
        return destination.getNeedsServed();
    }
}
