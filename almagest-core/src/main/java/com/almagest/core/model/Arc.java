package com.almagest.core.model;

import com.almagest.core.geometry.CircularGeometry;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A contiguous arc of the ecliptic, running prograde from {@code start} for {@code length} degrees.
 */
public record Arc(double start, double length) {

    public Arc {
        if (!Double.isFinite(length) || length < 0 || length > CircularGeometry.FULL_CIRCLE) {
            throw new IllegalArgumentException("Arc length must be within [0, 360]: " + length);
        }
        start = CircularGeometry.normalize(start);
    }

    /**
     * Longitude where the arc ends, normalized.
     */
    @JsonIgnore
    public double end() {
        return CircularGeometry.normalize(start + length);
    }

    @JsonIgnore
    public boolean isPoint() {
        return length == 0;
    }

    public boolean contains(double longitude) {
        return CircularGeometry.arcContains(this, longitude);
    }

    @Override
    public String toString() {
        return String.format("Arc[%.2f° +%.2f° -> %.2f°]", start, length, end());
    }
}
