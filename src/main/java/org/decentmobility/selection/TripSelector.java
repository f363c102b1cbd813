package org.decentmobility.selection;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.Builder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decentmobility.core.MobilityCore;
import org.decentmobility.core.MobilityCoreException;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Builds a destination-indexed trip selection from demand and a catalog of alternatives.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Resolve the method id before looking at demand or catalog.</li>
 * <li>Validate demand counts, tolerance and typical time.</li>
 * <li>Filter candidates per destination by destination and available mode.</li>
 * <li>Derive one entropy source per destination, in demand order, from the request's
 * generator so results do not depend on execution order.</li>
 * <li>Run the strategy per destination, sequentially or on the configured executor.</li>
 * </ul>
 * <p>Calls are atomic: any failing destination fails the whole call and no partial
 * result is returned.</p>
 */
public final class TripSelector {
    private static final Logger LOG = LogManager.getLogger(TripSelector.class);

    public static final double DEFAULT_TOLERANCE = 10.0d;

    private static final String PROP_DEFAULT_TOLERANCE = "decentmobility.selection.defaultToleranceMinutes";

    private final SelectionStrategyRegistry strategyRegistry;
    private final SelectionBudget budget;
    private final ExecutorService executor;
    private final double defaultTolerance;

    /**
     * Creates a selector.
     *
     * @param strategyRegistry optional registry; built-in strategies when null.
     * @param budget optional search budget; {@link SelectionBudget#defaults()} when null.
     * @param executor optional executor for per-destination parallelism; sequential when null.
     * @param defaultTolerance optional tolerance used when requests carry none.
     */
    @Builder
    public TripSelector(
            SelectionStrategyRegistry strategyRegistry,
            SelectionBudget budget,
            ExecutorService executor,
            Double defaultTolerance
    ) {
        this.strategyRegistry = strategyRegistry == null ? SelectionStrategyRegistry.defaultRegistry() : strategyRegistry;
        this.budget = budget == null ? SelectionBudget.defaults() : budget;
        this.executor = executor;
        this.defaultTolerance = requireTolerance(defaultTolerance == null ? readDefaultTolerance() : defaultTolerance);
    }

    /**
     * Creates a sequential selector with built-in strategies and property-backed defaults.
     */
    public static TripSelector defaults() {
        return TripSelector.builder().build();
    }

    /**
     * Selects alternatives for every destination of the request's demand.
     *
     * @throws MobilityCoreException with reason codes {@link MobilityCore#REASON_UNSUPPORTED_METHOD},
     *                               {@link MobilityCore#REASON_NO_FEASIBLE_ALTERNATIVE} or
     *                               {@link MobilityCore#REASON_INFEASIBLE_SELECTION} among others.
     */
    public SelectionResult select(SelectionRequest request) {
        if (request == null) {
            throw new MobilityCoreException(MobilityCore.REASON_SELECTION_REQUEST_REQUIRED, "selection request must be provided");
        }
        SelectionStrategy strategy = resolveStrategy(request.getMethod());
        double tolerance = requireTolerance(request.getTolerance() == null ? defaultTolerance : request.getTolerance());
        Double typicalTime = requireTypicalTime(request.getTypicalTime());
        TimeWindow.Mode windowMode = request.getWindowMode() == null
                ? TimeWindow.Mode.SYMMETRIC_BAND
                : request.getWindowMode();
        Set<String> unavailableModes = new ObjectOpenHashSet<>(request.getUnavailableModes());
        Random entropy = resolveEntropy(request);

        List<DestinationTask> tasks = new ArrayList<>(request.getDemand().size());
        for (Map.Entry<Location, Integer> entry : request.getDemand().entrySet()) {
            Location destination = Objects.requireNonNull(entry.getKey(), "destination");
            int count = requireCount(destination, entry.getValue());
            if (count == 0) {
                tasks.add(new DestinationTask(destination, 0, List.of(), null));
                continue;
            }
            List<Alternative> candidates = candidatesFor(destination, request.getCatalog(), unavailableModes);
            SelectionContext context = SelectionContext.builder()
                    .random(new Random(entropy.nextLong()))
                    .typicalTime(typicalTime)
                    .tolerance(tolerance)
                    .windowMode(windowMode)
                    .budget(budget)
                    .build();
            tasks.add(new DestinationTask(destination, count, candidates, context));
        }

        List<List<Alternative>> selections = executor == null
                ? runSequential(strategy, tasks)
                : runParallel(strategy, tasks);

        LinkedHashMap<Location, List<Alternative>> chosen = new LinkedHashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            chosen.put(tasks.get(i).destination(), selections.get(i));
        }
        SelectionResult result = new SelectionResult(strategy.id(), chosen);
        LOG.debug("selected {} trips over {} destinations with {}",
                result.allAlternatives().size(), chosen.size(), strategy.id());
        return result;
    }

    private SelectionStrategy resolveStrategy(String method) {
        SelectionStrategy strategy = strategyRegistry.strategy(method);
        if (strategy == null) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_UNSUPPORTED_METHOD,
                    method + " is not a valid method. Choose one of " + strategyRegistry.strategyIds()
            );
        }
        return strategy;
    }

    private List<List<Alternative>> runSequential(SelectionStrategy strategy, List<DestinationTask> tasks) {
        List<List<Alternative>> selections = new ArrayList<>(tasks.size());
        for (DestinationTask task : tasks) {
            selections.add(runTask(strategy, task));
        }
        return selections;
    }

    private List<List<Alternative>> runParallel(SelectionStrategy strategy, List<DestinationTask> tasks) {
        List<Callable<List<Alternative>>> callables = new ArrayList<>(tasks.size());
        for (DestinationTask task : tasks) {
            callables.add(() -> runTask(strategy, task));
        }
        List<Future<List<Alternative>>> futures = List.of();
        try {
            futures = executor.invokeAll(callables);
            List<List<Alternative>> selections = new ArrayList<>(futures.size());
            for (Future<List<Alternative>> future : futures) {
                selections.add(future.get());
            }
            return selections;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MobilityCoreException(MobilityCore.REASON_SELECTION_INTERRUPTED, "trip selection interrupted", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw new IllegalStateException("destination selection failed", ex.getCause());
        } finally {
            for (Future<List<Alternative>> future : futures) {
                future.cancel(true);
            }
        }
    }

    private List<Alternative> runTask(SelectionStrategy strategy, DestinationTask task) {
        if (task.count() == 0) {
            return List.of();
        }
        List<Alternative> selected;
        try {
            selected = strategy.select(task.destination(), task.count(), task.candidates(), task.context());
        } catch (SelectionStrategy.InfeasibleSelectionException ex) {
            LOG.warn("infeasible selection for {}: {}", task.destination(), ex.getMessage());
            throw new MobilityCoreException(
                    MobilityCore.REASON_INFEASIBLE_SELECTION,
                    "destination " + task.destination() + ": " + ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        } catch (SelectionBudget.BudgetExceededException ex) {
            LOG.warn("selection budget exhausted for {}: {}", task.destination(), ex.getMessage());
            throw new MobilityCoreException(
                    MobilityCore.REASON_INFEASIBLE_SELECTION,
                    "destination " + task.destination() + " with typical time " + task.context().getTypicalTime()
                            + " +/- " + task.context().getTolerance() + " (" + task.context().getWindowMode() + "): "
                            + ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
        return requireContract(strategy, task, selected);
    }

    private static List<Alternative> requireContract(SelectionStrategy strategy, DestinationTask task, List<Alternative> selected) {
        if (selected == null || selected.size() != task.count()) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_STRATEGY_CONTRACT_VIOLATED,
                    "strategy " + strategy.id() + " returned " + (selected == null ? "null" : selected.size())
                            + " alternatives for " + task.destination() + ", expected " + task.count()
            );
        }
        for (Alternative alternative : selected) {
            if (alternative == null || !task.destination().equals(alternative.getDestination())) {
                throw new MobilityCoreException(
                        MobilityCore.REASON_STRATEGY_CONTRACT_VIOLATED,
                        "strategy " + strategy.id() + " returned an alternative not serving " + task.destination()
                );
            }
        }
        return List.copyOf(selected);
    }

    private static List<Alternative> candidatesFor(Location destination, List<Alternative> catalog, Set<String> unavailableModes) {
        List<Alternative> candidates = new ArrayList<>();
        for (Alternative alternative : catalog) {
            if (destination.equals(alternative.getDestination()) && !unavailableModes.contains(alternative.getMode())) {
                candidates.add(alternative);
            }
        }
        if (candidates.isEmpty()) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_NO_FEASIBLE_ALTERNATIVE,
                    "No alternative found for destination: " + destination
            );
        }
        return candidates;
    }

    private static int requireCount(Location destination, Integer count) {
        if (count == null || count < 0) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_INVALID_DEMAND,
                    "demand for " + destination + " must be >= 0, got " + count
            );
        }
        return count;
    }

    private static double requireTolerance(double tolerance) {
        if (!Double.isFinite(tolerance) || tolerance < 0.0d) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_INVALID_TOLERANCE,
                    "tolerance must be finite and >= 0, got " + tolerance
            );
        }
        return tolerance;
    }

    private static Double requireTypicalTime(Double typicalTime) {
        if (typicalTime != null && (!Double.isFinite(typicalTime) || typicalTime < 0.0d)) {
            throw new MobilityCoreException(
                    MobilityCore.REASON_INVALID_TYPICAL_TIME,
                    "typical time must be finite and >= 0, got " + typicalTime
            );
        }
        return typicalTime;
    }

    private static Random resolveEntropy(SelectionRequest request) {
        if (request.getRandom() != null) {
            return request.getRandom();
        }
        if (request.getSeed() != null) {
            return new Random(request.getSeed());
        }
        return new Random();
    }

    private static double readDefaultTolerance() {
        String raw = System.getProperty(PROP_DEFAULT_TOLERANCE);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TOLERANCE;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(PROP_DEFAULT_TOLERANCE + " must be numeric, got '" + raw + "'", ex);
        }
    }

    private record DestinationTask(
            Location destination,
            int count,
            List<Alternative> candidates,
            SelectionContext context
    ) {
    }
}
