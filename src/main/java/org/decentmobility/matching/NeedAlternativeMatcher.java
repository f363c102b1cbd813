package org.decentmobility.matching;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.decentmobility.core.MobilityCore;
import org.decentmobility.core.MobilityCoreException;
import org.decentmobility.model.Agent;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;
import org.decentmobility.model.LocationRole;
import org.decentmobility.model.Need;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pairs an agent's declared needs with the alternatives in its plan.
 *
 * <p>Matching is keyed by the resolved {@code (origin, destination)} location pair:</p>
 * <ul>
 * <li>Each need's roles are resolved through the agent's location mapping. A later need
 * resolving to an already-seen key replaces the earlier need (last-write-wins).</li>
 * <li>Each planned alternative attaches to the entry for its key, replacing any alternative
 * attached before it; unmatched keys create alternative-only entries.</li>
 * <li>Entries are returned in first-seen key order.</li>
 * </ul>
 * <p>The matcher is stateless and a pure function of the agent.</p>
 */
public final class NeedAlternativeMatcher {

    /**
     * Matches needs and alternatives of one agent.
     *
     * @throws MobilityCoreException with {@link MobilityCore#REASON_UNRESOLVED_LOCATION_ROLE}
     *                               when a need references a role the agent does not map.
     */
    public List<NeedAlternativePair> match(Agent agent) {
        Objects.requireNonNull(agent, "agent");
        Object2ObjectLinkedOpenHashMap<ODKey, Slot> table =
                new Object2ObjectLinkedOpenHashMap<>(agent.getNeeds().size() + agent.getPlan().size());

        for (Need need : agent.getNeeds()) {
            ODKey key = new ODKey(
                    resolve(agent, need, need.getOrigin()),
                    resolve(agent, need, need.getDestination())
            );
            table.put(key, new Slot(need));
        }

        for (Alternative alternative : agent.getPlan()) {
            ODKey key = ODKey.of(alternative);
            Slot slot = table.get(key);
            if (slot == null) {
                slot = new Slot(null);
                table.put(key, slot);
            }
            slot.alternative = alternative;
        }

        List<NeedAlternativePair> pairs = new ArrayList<>(table.size());
        for (Map.Entry<ODKey, Slot> entry : table.entrySet()) {
            Slot slot = entry.getValue();
            pairs.add(new NeedAlternativePair(entry.getKey(), slot.need, slot.alternative));
        }
        return Collections.unmodifiableList(pairs);
    }

    private static Location resolve(Agent agent, Need need, LocationRole role) {
        return agent.location(role).orElseThrow(() -> new MobilityCoreException(
                MobilityCore.REASON_UNRESOLVED_LOCATION_ROLE,
                "agent has no location for role " + role + " referenced by need " + need
        ));
    }

    private static final class Slot {
        private final Need need;
        private Alternative alternative;

        private Slot(Need need) {
            this.need = need;
        }
    }
}
