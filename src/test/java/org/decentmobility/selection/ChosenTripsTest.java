package org.decentmobility.selection;

import org.decentmobility.model.Alternative;
import org.decentmobility.model.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.decentmobility.testutil.MobilityFixtures.SCHOOL;
import static org.decentmobility.testutil.MobilityFixtures.SUPERMARKET;
import static org.decentmobility.testutil.MobilityFixtures.option;
import static org.decentmobility.testutil.MobilityFixtures.supermarketCatalog;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ChosenTrips Tests")
class ChosenTripsTest {

    private static TripDemand demand() {
        Map<Location, Integer> demand = new LinkedHashMap<>();
        demand.put(SUPERMARKET, 2);
        demand.put(SCHOOL, 1);
        return new TripDemand("student", 12.0d, demand);
    }

    @Test
    @DisplayName("Store starts empty for every demanded destination")
    void testInitiallyEmpty() {
        ChosenTrips trips = ChosenTrips.forDemand(demand());
        assertEquals(List.of(SUPERMARKET, SCHOOL), List.copyOf(trips.snapshot().keySet()));
        assertTrue(trips.trips(SUPERMARKET).isEmpty());
    }

    @Test
    @DisplayName("Applying a partial result overwrites only its destinations")
    void testPartialOverwrite() {
        ChosenTrips trips = ChosenTrips.forDemand(demand());
        Alternative bus = option(SCHOOL, "bus", 3.0d, 1.0d, 20.0d);
        Alternative bike = option(SCHOOL, "bike", 3.0d, 0.1d, 18.0d);

        Map<Location, List<Alternative>> first = new LinkedHashMap<>();
        first.put(SUPERMARKET, List.of(supermarketCatalog().get(2), supermarketCatalog().get(2)));
        first.put(SCHOOL, List.of(bus));
        trips.apply(new SelectionResult("uniform-random", first));

        trips.apply(new SelectionResult("uniform-random", Map.of(SCHOOL, List.of(bike))));

        assertEquals(2, trips.trips(SUPERMARKET).size());
        assertEquals(List.of(bike), trips.trips(SCHOOL));
    }

    @Test
    @DisplayName("Snapshot is immutable")
    void testSnapshotImmutable() {
        ChosenTrips trips = ChosenTrips.forDemand(demand());
        assertThrows(UnsupportedOperationException.class, () -> trips.snapshot().clear());
    }

    @Test
    @DisplayName("Demand profile pre-fills selection requests")
    void testRequestBuilder() {
        SelectionResult result = TripSelector.defaults().select(demand().requestBuilder()
                .method(SelectionMethod.MIN_ENERGY_WITHIN_TIME_BUDGET.id())
                .catalog(supermarketCatalog())
                .candidate(option(SCHOOL, "bus", 3.0d, 1.0d, 20.0d))
                .candidate(option(SCHOOL, "bike", 3.0d, 0.1d, 18.0d))
                .tolerance(8.0d)
                .build());

        ChosenTrips trips = ChosenTrips.forDemand(demand());
        trips.apply(result);
        assertEquals(2, trips.trips(SUPERMARKET).size());
        assertEquals("bike", trips.trips(SCHOOL).get(0).getMode());
    }

    @Test
    @DisplayName("Demand profile rejects negative counts")
    void testNegativeDemand() {
        assertThrows(IllegalArgumentException.class,
                () -> new TripDemand("x", 10.0d, Map.of(SCHOOL, -1)));
    }
}
