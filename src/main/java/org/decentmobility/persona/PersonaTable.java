package org.decentmobility.persona;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied, ordered persona configuration.
 *
 * <p>Classification returns the first persona whose characteristics match, so tables
 * can be substituted per scenario or test without touching shared state.</p>
 */
public final class PersonaTable {
    private static final Map<Purpose, Integer> DEFAULT_TRIP_NEEDS = Map.of(
            Purpose.WORK, 4,
            Purpose.LEISURE, 1
    );

    private final List<Persona> personas;

    public PersonaTable(List<Persona> personas) {
        this.personas = List.copyOf(Objects.requireNonNull(personas, "personas"));
    }

    /**
     * Returns the built-in table: one persona per gender, each needing 4 work and 1 leisure trip a week.
     */
    public static PersonaTable defaults() {
        return new PersonaTable(List.of(
                new Persona(Gender.MALE, DEFAULT_TRIP_NEEDS),
                new Persona(Gender.FLINT, DEFAULT_TRIP_NEEDS)
        ));
    }

    /**
     * Returns the first persona classifying {@code person}, or empty when none matches.
     */
    public Optional<Persona> classify(Person person) {
        Objects.requireNonNull(person, "person");
        for (Persona persona : personas) {
            if (persona.isMember(person)) {
                return Optional.of(persona);
            }
        }
        return Optional.empty();
    }

    public List<Persona> personas() {
        return personas;
    }
}
