package org.decentmobility.model;

import lombok.Value;

import java.util.Objects;

/**
 * Destination category identified only by name (for example {@code "grocery_store"}).
 *
 * <p>Named locations have no coordinates, so alternatives between them carry an
 * externally supplied distance.</p>
 */
@Value
public class NamedLocation implements Location {
    String name;

    public NamedLocation(String name) {
        String normalized = Objects.requireNonNull(name, "name").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("location name must be non-blank");
        }
        this.name = normalized;
    }

    /**
     * Creates a named location.
     */
    public static NamedLocation of(String name) {
        return new NamedLocation(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
