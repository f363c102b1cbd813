package org.decentmobility.matching;

import org.decentmobility.core.MobilityCore;
import org.decentmobility.core.MobilityCoreException;
import org.decentmobility.model.Agent;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.GridLocation;
import org.decentmobility.model.LocationRole;
import org.decentmobility.model.Need;
import org.decentmobility.model.TripPurpose;
import org.decentmobility.testutil.MobilityFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.decentmobility.testutil.MobilityFixtures.A;
import static org.decentmobility.testutil.MobilityFixtures.B;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("NeedAlternativeMatcher Tests")
class NeedAlternativeMatcherTest {
    private final NeedAlternativeMatcher matcher = new NeedAlternativeMatcher();

    @Test
    @DisplayName("Needs without alternatives produce need-only entries in declaration order")
    void testNeedOnlyEntries() {
        List<NeedAlternativePair> pairs = matcher.match(MobilityFixtures.commuter());

        assertEquals(2, pairs.size());
        assertEquals(new ODKey(A, B), pairs.get(0).key());
        assertEquals(new ODKey(B, A), pairs.get(1).key());
        for (NeedAlternativePair pair : pairs) {
            assertTrue(pair.need().isPresent());
            assertTrue(pair.alternative().isEmpty());
            assertFalse(pair.isMatched());
        }
    }

    @Test
    @DisplayName("Alternatives attach to the need sharing their resolved key")
    void testMatchedEntries() {
        List<NeedAlternativePair> pairs = matcher.match(MobilityFixtures.commuterByBus());

        assertEquals(2, pairs.size());
        assertTrue(pairs.get(0).isMatched());
        assertEquals(A, pairs.get(0).alternative().orElseThrow().getOrigin());
        assertEquals(B, pairs.get(1).alternative().orElseThrow().getOrigin());
    }

    @Test
    @DisplayName("Unmatched alternatives produce alternative-only entries after the needs")
    void testAlternativeOnlyEntries() {
        GridLocation elsewhere = GridLocation.of(5, 5);
        Agent agent = MobilityFixtures.commuter().withPlan(List.of(
                Alternative.of(A, elsewhere, "car"),
                Alternative.of(A, B, "bus")
        ));

        List<NeedAlternativePair> pairs = matcher.match(agent);

        assertEquals(3, pairs.size());
        assertTrue(pairs.get(0).isMatched());
        assertTrue(pairs.get(1).alternative().isEmpty());
        NeedAlternativePair extra = pairs.get(2);
        assertEquals(new ODKey(A, elsewhere), extra.key());
        assertTrue(extra.need().isEmpty());
        assertEquals("car", extra.alternative().orElseThrow().getMode());
    }

    @Test
    @DisplayName("Colliding needs keep the last one at the first position")
    void testNeedCollisionLastWriteWins() {
        Need first = Need.of(TripPurpose.COMMUTE, LocationRole.HOME, LocationRole.WORK, 5);
        Need middle = Need.of(TripPurpose.COMMUTE, LocationRole.WORK, LocationRole.HOME, 5);
        Need last = Need.of(TripPurpose.OTHER, LocationRole.HOME, LocationRole.WORK, 2);
        Agent agent = Agent.builder()
                .location(LocationRole.HOME, A)
                .location(LocationRole.WORK, B)
                .need(first)
                .need(middle)
                .need(last)
                .build();

        List<NeedAlternativePair> pairs = matcher.match(agent);

        assertEquals(2, pairs.size());
        assertEquals(new ODKey(A, B), pairs.get(0).key());
        assertEquals(last, pairs.get(0).need().orElseThrow());
        assertEquals(middle, pairs.get(1).need().orElseThrow());
    }

    @Test
    @DisplayName("Later alternatives on the same key replace earlier ones")
    void testAlternativeCollisionKeepsLast() {
        Agent agent = MobilityFixtures.commuter().withPlan(List.of(
                Alternative.of(A, B, "bus"),
                Alternative.of(A, B, "bike")
        ));

        NeedAlternativePair pair = matcher.match(agent).get(0);

        assertEquals("bike", pair.alternative().orElseThrow().getMode());
    }

    @Test
    @DisplayName("Matching is a pure function of the agent")
    void testIdempotent() {
        Agent agent = MobilityFixtures.commuterByBus();
        assertEquals(matcher.match(agent), matcher.match(agent));
    }

    @Test
    @DisplayName("Needs referencing an unmapped role are rejected")
    void testUnresolvedRole() {
        Agent agent = Agent.builder()
                .location(LocationRole.HOME, A)
                .need(Need.of(TripPurpose.COMMUTE, LocationRole.HOME, LocationRole.WORK, 1))
                .build();

        MobilityCoreException ex = assertThrows(MobilityCoreException.class, () -> matcher.match(agent));
        assertEquals(MobilityCore.REASON_UNRESOLVED_LOCATION_ROLE, ex.getReasonCode());
        assertTrue(ex.getMessage().contains("WORK"));
    }

    @Test
    @DisplayName("Result list is immutable")
    void testImmutableResult() {
        List<NeedAlternativePair> pairs = matcher.match(MobilityFixtures.commuterByBus());
        assertThrows(UnsupportedOperationException.class, pairs::clear);
    }
}
