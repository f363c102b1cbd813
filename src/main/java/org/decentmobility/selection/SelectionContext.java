package org.decentmobility.selection;

import lombok.Builder;
import lombok.Value;

import java.util.Random;

/**
 * Per-destination inputs handed to a {@link SelectionStrategy}.
 */
@Value
@Builder
public class SelectionContext {
    /** Entropy source owned by this destination's selection. */
    Random random;
    /** Typical travel time of one trip, or null when the caller gave none. */
    Double typicalTime;
    /** Allowed deviation of the mean trip time from {@code typicalTime}. */
    double tolerance;
    /** Shape of the time constraint. */
    TimeWindow.Mode windowMode;
    /** Search bounds for optimizing strategies. */
    SelectionBudget budget;
}
