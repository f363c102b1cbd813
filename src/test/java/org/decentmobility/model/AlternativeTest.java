package org.decentmobility.model;

import org.decentmobility.geometry.DistanceStrategy;
import org.decentmobility.geometry.DistanceStrategyRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Alternative Tests")
class AlternativeTest {

    @Test
    @DisplayName("Grid alternatives derive distance and ignore the supplied value")
    void testDerivedDistance() {
        Alternative alternative = Alternative.builder()
                .origin(GridLocation.of(0, 0))
                .destination(GridLocation.of(3, 4))
                .mode("bike")
                .distance(99.0d)
                .build();
        assertEquals(5.0d, alternative.getDistance(), 1e-12);
    }

    @Test
    @DisplayName("Named alternatives keep the supplied distance")
    void testSuppliedDistance() {
        Alternative alternative = Alternative.builder()
                .origin(NamedLocation.of("home"))
                .destination(NamedLocation.of("supermarket"))
                .mode("walk")
                .distance(2.5d)
                .energy(0.0d)
                .time(30.0d)
                .build();
        assertEquals(2.5d, alternative.getDistance(), 0.0d);
        assertEquals(30.0d, alternative.getTime(), 0.0d);
    }

    @Test
    @DisplayName("Custom distance registry is honored")
    void testCustomRegistry() {
        DistanceStrategy constant = new DistanceStrategy() {
            @Override
            public String id() {
                return "CONSTANT";
            }

            @Override
            public boolean supports(Location origin, Location destination) {
                return true;
            }

            @Override
            public double distance(Location origin, Location destination) {
                return 42.0d;
            }
        };
        Alternative alternative = Alternative.builder()
                .origin(NamedLocation.of("a"))
                .destination(NamedLocation.of("b"))
                .mode("car")
                .distanceStrategies(new DistanceStrategyRegistry(List.of(constant)))
                .build();
        assertEquals(42.0d, alternative.getDistance(), 0.0d);
    }

    @Test
    @DisplayName("Mode is trimmed and must be non-blank")
    void testModeValidation() {
        assertEquals("bus", Alternative.of(GridLocation.of(0, 0), GridLocation.of(1, 0), " bus ").getMode());
        assertThrows(IllegalArgumentException.class,
                () -> Alternative.of(GridLocation.of(0, 0), GridLocation.of(1, 0), " "));
        assertThrows(NullPointerException.class,
                () -> Alternative.of(GridLocation.of(0, 0), GridLocation.of(1, 0), null));
    }

    @Test
    @DisplayName("Negative or non-finite numbers are rejected")
    void testNumericValidation() {
        assertThrows(IllegalArgumentException.class, () -> Alternative.builder()
                .origin(NamedLocation.of("a")).destination(NamedLocation.of("b")).mode("car")
                .energy(-1.0d).build());
        assertThrows(IllegalArgumentException.class, () -> Alternative.builder()
                .origin(NamedLocation.of("a")).destination(NamedLocation.of("b")).mode("car")
                .time(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> Alternative.builder()
                .origin(NamedLocation.of("a")).destination(NamedLocation.of("b")).mode("car")
                .cost(Double.POSITIVE_INFINITY).build());
    }

    @Test
    @DisplayName("Structurally equal alternatives are equal")
    void testStructuralEquality() {
        Alternative first = Alternative.of(GridLocation.of(0, 0), GridLocation.of(1, 0), "bus");
        Alternative second = Alternative.of(GridLocation.of(-0.0d, 0), GridLocation.of(1, 0), "bus");
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
