package org.decentmobility.persona;

import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * Archetype shared by every person it classifies.
 *
 * <p>A persona carries no person-specific state; membership is a characteristic
 * match and its trip-need table is handed out as an immutable copy.</p>
 */
@Value
public class Persona {
    Gender gender;
    /** Decent-mobility trip needs for every member. */
    Map<Purpose, Integer> tripNeeds;

    public Persona(Gender gender, Map<Purpose, Integer> tripNeeds) {
        this.gender = Objects.requireNonNull(gender, "gender");
        this.tripNeeds = Person.copyNeeds(tripNeeds);
    }

    /**
     * Returns true when {@code person} belongs to the group this persona describes.
     */
    public boolean isMember(Person person) {
        return Objects.requireNonNull(person, "person").getGender() == gender;
    }
}
