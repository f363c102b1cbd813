package org.decentmobility.selection;

import it.unimi.dsi.fastutil.doubles.Double2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.decentmobility.core.MobilityCore;
import org.decentmobility.core.MobilityCoreException;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Minimum-energy selection under a summed travel-time window.
 *
 * <p>Integer program over per-candidate selection counts {@code k_i}:</p>
 * <ul>
 * <li>minimize {@code sum(k_i * energy_i)};</li>
 * <li>{@code sum(k_i) == count};</li>
 * <li>{@code window.lower <= sum(k_i * time_i) <= window.upper};</li>
 * <li>{@code 0 <= k_i <= count}, integer.</li>
 * </ul>
 * <p>Candidates sharing a travel time are first reduced to the cheapest one (earliest in
 * catalog order on ties); a costlier twin never improves a selection. The rest is solved
 * exactly by depth-first branch-and-bound over candidates sorted by ascending energy
 * (catalog order among equal energies). Each level fixes one {@code k_i}, largest first,
 * so cheap complete selections are found early. A subtree is pruned when its energy lower
 * bound cannot beat the incumbent or when no completion can reach the time window; states
 * proven unable to reach the window are remembered and skipped on revisits. Only strictly
 * cheaper selections replace the incumbent, which makes the result deterministic for a
 * given catalog order.</p>
 */
final class MinEnergySelectionStrategy implements SelectionStrategy {
    static final String REASON_NO_POINT_IN_WINDOW = "SELECTION_NO_POINT_IN_TIME_WINDOW";

    private static final double ENERGY_EPSILON = 1e-9d;
    private static final int ELAPSED_CHECK_INTERVAL = 1 << 10;

    @Override
    public String id() {
        return SelectionMethod.MIN_ENERGY_WITHIN_TIME_BUDGET.id();
    }

    @Override
    public Set<String> aliases() {
        return SelectionMethod.MIN_ENERGY_WITHIN_TIME_BUDGET.aliases();
    }

    @Override
    public List<Alternative> select(Location destination, int count, List<Alternative> candidates, SelectionContext context) {
        Double typicalTime = context.getTypicalTime();
        if (typicalTime == null) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_TYPICAL_TIME_REQUIRED,
                    "method " + id() + " requires a typical travel time"
            );
        }
        TimeWindow window = TimeWindow.around(count, typicalTime, context.getTolerance(), context.getWindowMode());
        int[] counts = solve(count, candidates, window, context.getBudget());
        if (counts == null) {
            throw new InfeasibleSelectionException(
                    REASON_NO_POINT_IN_WINDOW,
                    "no selection of " + count + " trips to " + destination + " has total time in " + window
            );
        }

        List<Alternative> chosen = new ArrayList<>(count);
        for (int i = 0; i < candidates.size(); i++) {
            for (int k = 0; k < counts[i]; k++) {
                chosen.add(candidates.get(i));
            }
        }
        return chosen;
    }

    /**
     * Returns optimal selection counts indexed like {@code candidates}, or null when infeasible.
     */
    int[] solve(int count, List<Alternative> candidates, TimeWindow window, SelectionBudget budget) {
        Search search = new Search(candidates, window, budget);
        search.run(0, count, 0.0d, 0.0d);
        if (search.bestCounts == null) {
            return null;
        }
        int[] byCatalog = new int[candidates.size()];
        for (int position = 0; position < search.order.length; position++) {
            byCatalog[search.order[position]] = search.bestCounts[position];
        }
        return byCatalog;
    }

    /**
     * Keeps one candidate per distinct travel time: the cheapest, earliest in catalog order on ties.
     *
     * @return catalog indexes sorted by ascending energy, catalog order among equal energies.
     */
    private static int[] dominantCandidates(List<Alternative> candidates) {
        Double2IntLinkedOpenHashMap byTime = new Double2IntLinkedOpenHashMap(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            // +0.0 folds -0.0 into the same key
            double time = candidates.get(i).getTime() + 0.0d;
            if (!byTime.containsKey(time) || candidates.get(i).getEnergy() < candidates.get(byTime.get(time)).getEnergy()) {
                byTime.put(time, i);
            }
        }
        int[] kept = byTime.values().toIntArray();
        Integer[] boxed = new Integer[kept.length];
        for (int position = 0; position < kept.length; position++) {
            boxed[position] = kept[position];
        }
        Arrays.sort(boxed, Comparator.<Integer>comparingDouble(i -> candidates.get(i).getEnergy())
                .thenComparingInt(i -> i));
        int[] order = new int[boxed.length];
        for (int position = 0; position < boxed.length; position++) {
            order[position] = boxed[position];
        }
        return order;
    }

    private static final class Search {
        private final int[] order;
        private final double[] energy;
        private final double[] time;
        private final double[] suffixMinEnergy;
        private final double[] suffixMinTime;
        private final double[] suffixMaxTime;
        private final TimeWindow window;
        private final SelectionBudget budget;
        private final long startNanos = System.nanoTime();
        private final Set<SearchState> unreachable = new ObjectOpenHashSet<>();

        private final int[] counts;
        private int[] bestCounts;
        private double bestEnergy = Double.POSITIVE_INFINITY;
        private long searchNodes;

        private Search(List<Alternative> candidates, TimeWindow window, SelectionBudget budget) {
            this.order = dominantCandidates(candidates);
            int n = order.length;
            this.energy = new double[n];
            this.time = new double[n];
            for (int position = 0; position < n; position++) {
                Alternative alternative = candidates.get(order[position]);
                energy[position] = alternative.getEnergy();
                time[position] = alternative.getTime();
            }

            this.suffixMinEnergy = new double[n + 1];
            this.suffixMinTime = new double[n + 1];
            this.suffixMaxTime = new double[n + 1];
            suffixMinEnergy[n] = Double.POSITIVE_INFINITY;
            suffixMinTime[n] = Double.POSITIVE_INFINITY;
            suffixMaxTime[n] = Double.NEGATIVE_INFINITY;
            for (int position = n - 1; position >= 0; position--) {
                suffixMinEnergy[position] = Math.min(energy[position], suffixMinEnergy[position + 1]);
                suffixMinTime[position] = Math.min(time[position], suffixMinTime[position + 1]);
                suffixMaxTime[position] = Math.max(time[position], suffixMaxTime[position + 1]);
            }

            this.window = window;
            this.budget = budget == null ? SelectionBudget.unbounded() : budget;
            this.counts = new int[n];
        }

        /**
         * Explores one state.
         *
         * @return false only when no completion of this state reaches the time window.
         */
        private boolean run(int position, int remaining, double partialEnergy, double partialTime) {
            searchNodes++;
            budget.checkSearchNodes(searchNodes);
            if ((searchNodes & (ELAPSED_CHECK_INTERVAL - 1)) == 0) {
                budget.checkElapsed(startNanos);
            }

            if (remaining == 0) {
                if (!window.contains(partialTime)) {
                    return false;
                }
                if (partialEnergy < bestEnergy - ENERGY_EPSILON) {
                    bestEnergy = partialEnergy;
                    bestCounts = counts.clone();
                }
                return true;
            }
            if (position == order.length) {
                return false;
            }
            if (!window.overlaps(
                    partialTime + remaining * suffixMinTime[position],
                    partialTime + remaining * suffixMaxTime[position])) {
                return false;
            }
            // reachability below is unknown once pruned on energy
            if (partialEnergy + remaining * suffixMinEnergy[position] >= bestEnergy - ENERGY_EPSILON) {
                return true;
            }
            SearchState state = new SearchState(position, remaining, partialTime);
            if (unreachable.contains(state)) {
                return false;
            }

            boolean reachable = false;
            int minTake = position == order.length - 1 ? remaining : 0;
            for (int take = remaining; take >= minTake; take--) {
                counts[position] = take;
                reachable |= run(
                        position + 1,
                        remaining - take,
                        partialEnergy + take * energy[position],
                        partialTime + take * time[position]
                );
            }
            counts[position] = 0;
            if (!reachable) {
                unreachable.add(state);
            }
            return reachable;
        }
    }

    private record SearchState(int position, int remaining, double partialTime) {
    }
}
