package com.almagest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Identifier of a celestial body. Carries no behavior; used as a lookup key by providers.
 */
public record Body(String name) {

    public static final Body SUN = new Body("Sun");
    public static final Body MOON = new Body("Moon");
    public static final Body MERCURY = new Body("Mercury");
    public static final Body VENUS = new Body("Venus");
    public static final Body MARS = new Body("Mars");
    public static final Body JUPITER = new Body("Jupiter");
    public static final Body SATURN = new Body("Saturn");

    /**
     * The seven classical bodies, in traditional order.
     */
    public static final List<Body> CLASSICAL = List.of(SUN, MOON, MERCURY, VENUS, MARS, JUPITER, SATURN);

    public Body {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Body name must not be blank");
        }
    }

    @JsonCreator
    public static Body of(String name) {
        return new Body(name);
    }

    @JsonValue
    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
