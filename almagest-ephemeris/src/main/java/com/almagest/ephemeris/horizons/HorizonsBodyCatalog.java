package com.almagest.ephemeris.horizons;

import com.almagest.core.model.Body;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps bodies to Horizons target codes (the COMMAND parameter).
 */
public final class HorizonsBodyCatalog {

    private static final HorizonsBodyCatalog DEFAULTS = new HorizonsBodyCatalog(Map.of())
        .with(Body.SUN, "10")
        .with(Body.MOON, "301")
        .with(Body.MERCURY, "199")
        .with(Body.VENUS, "299")
        .with(Body.MARS, "499")
        .with(Body.JUPITER, "599")
        .with(Body.SATURN, "699");

    private final Map<Body, String> codes;

    private HorizonsBodyCatalog(Map<Body, String> codes) {
        this.codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
    }

    /**
     * Sun, Moon and the five classical planets.
     */
    public static HorizonsBodyCatalog defaults() {
        return DEFAULTS;
    }

    public HorizonsBodyCatalog with(Body body, String targetCode) {
        Objects.requireNonNull(body, "body");
        if (targetCode == null || targetCode.isBlank()) {
            throw new IllegalArgumentException("Target code must not be blank for " + body);
        }
        Map<Body, String> copy = new LinkedHashMap<>(codes);
        copy.put(body, targetCode.trim());
        return new HorizonsBodyCatalog(copy);
    }

    public Optional<String> codeFor(Body body) {
        return Optional.ofNullable(codes.get(body));
    }

    public Map<Body, String> getCodes() {
        return codes;
    }
}
