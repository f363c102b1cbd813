package org.decentmobility.selection;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.List;
import java.util.Set;

/**
 * Chooses exactly {@code count} alternatives for one destination.
 *
 * <p>Candidates passed in are already filtered to the destination and to available
 * modes, and are never empty. Implementations must be stateless and draw randomness
 * only from {@link SelectionContext#getRandom()}.</p>
 */
public interface SelectionStrategy {
    /**
     * Stable method id used in selection requests.
     */
    String id();

    /**
     * Alternate method ids resolving to this strategy.
     */
    default Set<String> aliases() {
        return Set.of();
    }

    /**
     * Selects {@code count} alternatives; the same candidate may be chosen repeatedly.
     *
     * @throws InfeasibleSelectionException when no selection satisfies the strategy's constraints.
     */
    List<Alternative> select(Location destination, int count, List<Alternative> candidates, SelectionContext context);

    /**
     * Deterministic failure raised when a strategy has no feasible selection.
     */
    @Getter
    @Accessors(fluent = true)
    final class InfeasibleSelectionException extends RuntimeException {
        private final String reasonCode;

        public InfeasibleSelectionException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
