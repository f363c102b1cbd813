package org.decentmobility.selection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Client-facing trip selection request.
 *
 * <p>Demand keeps caller insertion order, which is also the order of the result.
 * Randomness comes from {@code random} when set, else from a generator seeded with
 * {@code seed}; without either, each call uses a fresh unseeded generator.</p>
 */
@Value
@Builder(toBuilder = true)
public class SelectionRequest {
    /** Required trip count per destination. */
    @Singular("destination")
    Map<Location, Integer> demand;
    /** Candidate alternatives across all destinations. */
    @Singular("candidate")
    List<Alternative> catalog;
    /** Selection method id or alias, for example {@code uniform-random}. */
    String method;
    /** Modes that must not be chosen. */
    @Singular
    Set<String> unavailableModes;
    /** Seed for reproducible random selection. */
    Long seed;
    /** Explicit entropy source; takes precedence over {@code seed}. */
    Random random;
    /** Typical travel time of one trip, required by time-windowed methods. */
    Double typicalTime;
    /** Allowed deviation of the mean trip time; the selector default applies when null. */
    Double tolerance;
    /** Shape of the time constraint; {@link TimeWindow.Mode#SYMMETRIC_BAND} when null. */
    TimeWindow.Mode windowMode;
}
