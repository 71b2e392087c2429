package com.almagest.core.provider.analytic;

import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of mean elements sharing one reference epoch.
 * Several configurations (different epochs or constants) can be used side by side.
 */
public final class OrbitModelConfig {

    private final JulianDate epoch;
    private final Map<Body, MeanElements> elements;

    public OrbitModelConfig(JulianDate epoch, Map<Body, MeanElements> elements) {
        this.epoch = Objects.requireNonNull(epoch, "epoch");
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    }

    /**
     * The bundled J2000 constants.
     */
    public static OrbitModelConfig j2000() {
        return OrbitModelConfigLoader.loadBundled();
    }

    public JulianDate getEpoch() {
        return epoch;
    }

    public Map<Body, MeanElements> getElements() {
        return elements;
    }

    public Optional<MeanElements> elementsFor(Body body) {
        return Optional.ofNullable(elements.get(body));
    }

    public Set<Body> getBodies() {
        return elements.keySet();
    }

    /**
     * Copy with one body added or replaced.
     */
    public OrbitModelConfig withBody(Body body, MeanElements meanElements) {
        Map<Body, MeanElements> copy = new LinkedHashMap<>(elements);
        copy.put(Objects.requireNonNull(body, "body"), Objects.requireNonNull(meanElements, "meanElements"));
        return new OrbitModelConfig(epoch, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrbitModelConfig other)) return false;
        return epoch.equals(other.epoch) && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(epoch, elements);
    }

    @Override
    public String toString() {
        return "OrbitModelConfig[epoch=" + epoch + ", bodies=" + elements.keySet() + "]";
    }
}
