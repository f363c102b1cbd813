package org.decentmobility.persona;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single individual with measurable characteristics and per-purpose trip needs.
 */
@Value
public class Person {
    Gender gender;
    /** Counts of trips needed per purpose over the reference week. */
    Map<Purpose, Integer> tripNeeds;

    public Person(Gender gender, Map<Purpose, Integer> tripNeeds) {
        this.gender = Objects.requireNonNull(gender, "gender");
        this.tripNeeds = copyNeeds(tripNeeds);
    }

    /**
     * Creates a person without trip needs.
     */
    public static Person of(Gender gender) {
        return new Person(gender, Map.of());
    }

    /**
     * Returns the need for one purpose, zero when undeclared.
     */
    public int tripNeed(Purpose purpose) {
        return tripNeeds.getOrDefault(purpose, 0);
    }

    /**
     * Returns a copy of this person adopting the trip needs of its classified persona.
     *
     * @throws IllegalStateException when no persona in the table classifies this person.
     */
    public Person withTripNeedsFrom(PersonaTable personas) {
        Persona persona = Objects.requireNonNull(personas, "personas")
                .classify(this)
                .orElseThrow(() -> new IllegalStateException("no persona classifies person with gender " + gender));
        return new Person(gender, persona.getTripNeeds());
    }

    static Map<Purpose, Integer> copyNeeds(Map<Purpose, Integer> source) {
        EnumMap<Purpose, Integer> copy = new EnumMap<>(Purpose.class);
        if (source != null) {
            for (Map.Entry<Purpose, Integer> entry : source.entrySet()) {
                Purpose purpose = Objects.requireNonNull(entry.getKey(), "purpose");
                int count = Objects.requireNonNull(entry.getValue(), "trip need for " + purpose);
                if (count < 0) {
                    throw new IllegalArgumentException("trip need for " + purpose + " must be >= 0, got " + count);
                }
                copy.put(purpose, count);
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
