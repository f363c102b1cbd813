package org.decentmobility.evaluation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decentmobility.core.MobilityCore;
import org.decentmobility.core.MobilityCoreException;
import org.decentmobility.matching.NeedAlternativeMatcher;
import org.decentmobility.matching.NeedAlternativePair;
import org.decentmobility.model.Agent;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Need;
import org.decentmobility.model.Population;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Per-agent and population decent-mobility predicates over matched needs and alternatives.
 *
 * <p>The evaluator is stateless apart from its configuration and may be shared across
 * threads.</p>
 */
public final class DecentMobilityEvaluator {
    private static final Logger LOG = LogManager.getLogger(DecentMobilityEvaluator.class);

    private final NeedAlternativeMatcher matcher;
    private final DecencyCriterion criterion;

    public DecentMobilityEvaluator(NeedAlternativeMatcher matcher, DecencyCriterion criterion) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.criterion = Objects.requireNonNull(criterion, "criterion");
    }

    /**
     * Creates an evaluator applying {@link DecencyCriterion#NEEDS_MATCHED}.
     */
    public static DecentMobilityEvaluator defaults() {
        return new DecentMobilityEvaluator(new NeedAlternativeMatcher(), DecencyCriterion.NEEDS_MATCHED);
    }

    public DecencyCriterion criterion() {
        return criterion;
    }

    public NeedAlternativeMatcher matcher() {
        return matcher;
    }

    /**
     * Returns true if the agent has decent mobility under the configured criterion.
     *
     * @throws MobilityCoreException when a need references an unmapped location role.
     */
    public boolean isDecent(Agent agent) {
        Objects.requireNonNull(agent, "agent");
        return switch (criterion) {
            case NEEDS_MATCHED -> everyNeedMatched(matcher.match(agent));
            case PLAN_SIZE -> agent.getPlan().size() >= positiveNeedCount(agent);
        };
    }

    /**
     * Returns true if every agent has decent mobility, stopping at the first agent that does not.
     */
    public boolean isDecentPopulation(Collection<Agent> agents) {
        Objects.requireNonNull(agents, "agents");
        int evaluated = 0;
        for (Agent agent : agents) {
            evaluated++;
            if (!isDecent(agent)) {
                LOG.debug("population not decent: agent {} of {} fails {}", evaluated, agents.size(), criterion);
                return false;
            }
        }
        LOG.debug("population decent: all {} agents pass {}", evaluated, criterion);
        return true;
    }

    /**
     * Returns true if every agent of {@code population} has decent mobility.
     */
    public boolean isDecentPopulation(Population population) {
        return isDecentPopulation(Objects.requireNonNull(population, "population").getAgents());
    }

    /**
     * Data-parallel variant of {@link #isDecentPopulation(Collection)}.
     *
     * <p>Agents are evaluated as independent tasks on {@code executor}; outcomes are read in
     * agent order, so the result and any failure are those of the sequential variant. Once
     * an agent is found not decent, the outstanding tasks are cancelled and failures of later
     * agents are ignored. The executor is not shut down.</p>
     */
    public boolean isDecentPopulation(Collection<Agent> agents, ExecutorService executor) {
        Objects.requireNonNull(agents, "agents");
        Objects.requireNonNull(executor, "executor");
        List<Future<Boolean>> futures = new ArrayList<>(agents.size());
        try {
            for (Agent agent : agents) {
                Agent nonNull = Objects.requireNonNull(agent, "agent");
                futures.add(executor.submit(() -> isDecent(nonNull)));
            }
            for (int i = 0; i < futures.size(); i++) {
                if (!futures.get(i).get()) {
                    LOG.debug("population not decent: agent {} of {} fails {}", i + 1, futures.size(), criterion);
                    return false;
                }
            }
            LOG.debug("population decent: all {} agents pass {}", futures.size(), criterion);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MobilityCoreException(
                    MobilityCore.REASON_EVALUATION_INTERRUPTED,
                    "population evaluation interrupted",
                    ex
            );
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw new IllegalStateException("agent evaluation failed", ex.getCause());
        } finally {
            for (Future<Boolean> future : futures) {
                future.cancel(true);
            }
        }
    }

    /**
     * Sums {@code need.count * alternative.distance} over fully matched pairs.
     *
     * <p>Reporting metric only; unmatched needs and unmatched alternatives contribute nothing.</p>
     */
    public double totalDistance(Agent agent) {
        double total = 0.0d;
        for (NeedAlternativePair pair : matcher.match(Objects.requireNonNull(agent, "agent"))) {
            if (!pair.isMatched()) {
                continue;
            }
            Need need = pair.need().orElseThrow();
            Alternative alternative = pair.alternative().orElseThrow();
            total += need.getCount() * alternative.getDistance();
        }
        return total;
    }

    private static boolean everyNeedMatched(List<NeedAlternativePair> pairs) {
        for (NeedAlternativePair pair : pairs) {
            boolean requiresTrip = pair.need().map(need -> need.getCount() > 0).orElse(false);
            if (requiresTrip && pair.alternative().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static int positiveNeedCount(Agent agent) {
        int count = 0;
        for (Need need : agent.getNeeds()) {
            if (need.getCount() > 0) {
                count++;
            }
        }
        return count;
    }
}
