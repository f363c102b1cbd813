package org.decentmobility.selection;

import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Draws {@code count} candidates independently and uniformly, with replacement.
 */
final class UniformRandomSelectionStrategy implements SelectionStrategy {

    @Override
    public String id() {
        return SelectionMethod.UNIFORM_RANDOM.id();
    }

    @Override
    public Set<String> aliases() {
        return SelectionMethod.UNIFORM_RANDOM.aliases();
    }

    @Override
    public List<Alternative> select(Location destination, int count, List<Alternative> candidates, SelectionContext context) {
        Random random = Objects.requireNonNull(context.getRandom(), "random");
        List<Alternative> chosen = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            chosen.add(candidates.get(random.nextInt(candidates.size())));
        }
        return chosen;
    }
}
