package org.decentmobility.model;

import org.decentmobility.testutil.MobilityFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Agent Tests")
class AgentTest {

    @Test
    @DisplayName("Roles resolve through the location mapping")
    void testLocationResolution() {
        Agent agent = MobilityFixtures.commuter();
        assertEquals(MobilityFixtures.A, agent.location(LocationRole.HOME).orElseThrow());
        assertEquals(MobilityFixtures.B, agent.location(LocationRole.WORK).orElseThrow());

        Agent homeless = Agent.builder().location(LocationRole.WORK, MobilityFixtures.B).build();
        assertTrue(homeless.location(LocationRole.HOME).isEmpty());
    }

    @Test
    @DisplayName("withPlan replaces the plan and leaves the original untouched")
    void testWithPlanReplaces() {
        Agent agent = MobilityFixtures.commuterByBus();
        Alternative car = Alternative.of(MobilityFixtures.A, MobilityFixtures.B, "car");

        Agent replanned = agent.withPlan(List.of(car));

        assertNotSame(agent, replanned);
        assertEquals(List.of(car), replanned.getPlan());
        assertEquals(2, agent.getPlan().size());
        assertEquals(agent.getNeeds(), replanned.getNeeds());
        assertEquals(agent.getLocations(), replanned.getLocations());
    }

    @Test
    @DisplayName("Collections are immutable and reject null elements")
    void testImmutability() {
        Agent agent = MobilityFixtures.commuterByBus();
        assertThrows(UnsupportedOperationException.class, () -> agent.getPlan().clear());
        assertThrows(UnsupportedOperationException.class, () -> agent.getNeeds().clear());
        assertThrows(UnsupportedOperationException.class, () -> agent.getLocations().clear());
        assertThrows(NullPointerException.class, () -> agent.withPlan(null));
    }

    @Test
    @DisplayName("Need rejects negative counts and accepts zero")
    void testNeedValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> Need.of(TripPurpose.OTHER, LocationRole.HOME, LocationRole.WORK, -1));
        assertEquals(0, Need.of(TripPurpose.OTHER, LocationRole.HOME, LocationRole.WORK, 0).getCount());
    }

    @Test
    @DisplayName("Locations compare structurally")
    void testLocationEquality() {
        assertEquals(GridLocation.of(1, 2), GridLocation.of(1.0d, 2.0d));
        assertEquals(NamedLocation.of(" school "), NamedLocation.of("school"));
        assertEquals("school", NamedLocation.of("school").toString());
        assertThrows(IllegalArgumentException.class, () -> GeoLocation.of(91.0d, 0.0d));
        assertThrows(IllegalArgumentException.class, () -> GridLocation.of(Double.NaN, 0.0d));
        assertThrows(IllegalArgumentException.class, () -> NamedLocation.of(""));
    }

    @Test
    @DisplayName("Population keeps agent order")
    void testPopulation() {
        Agent first = MobilityFixtures.commuter();
        Agent second = MobilityFixtures.commuterByBus();
        Population population = Population.of(first, second);
        assertEquals(2, population.size());
        assertEquals(List.of(first, second), population.getAgents());
    }
}
