package org.decentmobility.persona;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PersonaTable Tests")
class PersonaTableTest {

    @Test
    @DisplayName("Default table classifies every gender with four work and one leisure trip")
    void testDefaultClassification() {
        PersonaTable table = PersonaTable.defaults();
        for (Gender gender : Gender.values()) {
            Persona persona = table.classify(Person.of(gender)).orElseThrow();
            assertEquals(gender, persona.getGender());
            assertEquals(4, persona.getTripNeeds().get(Purpose.WORK));
            assertEquals(1, persona.getTripNeeds().get(Purpose.LEISURE));
        }
    }

    @Test
    @DisplayName("Person adopts the trip needs of its persona")
    void testAdoptTripNeeds() {
        Person person = Person.of(Gender.FLINT).withTripNeedsFrom(PersonaTable.defaults());
        assertEquals(4, person.tripNeed(Purpose.WORK));
        assertEquals(1, person.tripNeed(Purpose.LEISURE));
        assertEquals(Gender.FLINT, person.getGender());
    }

    @Test
    @DisplayName("Custom table takes precedence and can leave persons unclassified")
    void testCustomTable() {
        PersonaTable table = new PersonaTable(List.of(
                new Persona(Gender.MALE, Map.of(Purpose.LEISURE, 3))
        ));
        Person male = Person.of(Gender.MALE).withTripNeedsFrom(table);
        assertEquals(0, male.tripNeed(Purpose.WORK));
        assertEquals(3, male.tripNeed(Purpose.LEISURE));

        assertTrue(table.classify(Person.of(Gender.FLINT)).isEmpty());
        assertThrows(IllegalStateException.class, () -> Person.of(Gender.FLINT).withTripNeedsFrom(table));
    }

    @Test
    @DisplayName("First matching persona wins")
    void testFirstMatchWins() {
        PersonaTable table = new PersonaTable(List.of(
                new Persona(Gender.MALE, Map.of(Purpose.WORK, 5)),
                new Persona(Gender.MALE, Map.of(Purpose.WORK, 1))
        ));
        assertEquals(5, table.classify(Person.of(Gender.MALE)).orElseThrow().getTripNeeds().get(Purpose.WORK));
        assertEquals(2, table.personas().size());
    }

    @Test
    @DisplayName("Negative trip needs are rejected")
    void testNegativeNeedsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Person(Gender.MALE, Map.of(Purpose.WORK, -1)));
        assertThrows(IllegalArgumentException.class, () -> new Persona(Gender.MALE, Map.of(Purpose.WORK, -1)));
    }
}
