package org.decentmobility.selection;

import lombok.Value;
import org.decentmobility.model.Location;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named demand profile: how many trips a persona wants per destination, and its typical
 * travel time per trip.
 */
@Value
public class TripDemand {
    String name;
    /** Typical travel time of one trip, in the same unit as {@code Alternative.time}. */
    double typicalTravelTime;
    /** Trips wanted per destination, in declaration order. */
    Map<Location, Integer> demand;

    public TripDemand(String name, double typicalTravelTime, Map<Location, Integer> demand) {
        this.name = Objects.requireNonNull(name, "name");
        if (!Double.isFinite(typicalTravelTime) || typicalTravelTime < 0.0d) {
            throw new IllegalArgumentException("typicalTravelTime must be finite and >= 0, got " + typicalTravelTime);
        }
        this.typicalTravelTime = typicalTravelTime;
        LinkedHashMap<Location, Integer> copy = new LinkedHashMap<>();
        for (Map.Entry<Location, Integer> entry : Objects.requireNonNull(demand, "demand").entrySet()) {
            Integer count = Objects.requireNonNull(entry.getValue(), "demand count");
            if (count < 0) {
                throw new IllegalArgumentException("demand for " + entry.getKey() + " must be >= 0, got " + count);
            }
            copy.put(Objects.requireNonNull(entry.getKey(), "destination"), count);
        }
        this.demand = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a request builder pre-filled with this profile's demand and typical time.
     */
    public SelectionRequest.SelectionRequestBuilder requestBuilder() {
        return SelectionRequest.builder()
                .demand(demand)
                .typicalTime(typicalTravelTime);
    }
}
