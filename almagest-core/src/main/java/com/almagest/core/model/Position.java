package com.almagest.core.model;

import com.almagest.core.geometry.CircularGeometry;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Ecliptic position of a body at an instant.
 * Latitude is null when the provider cannot estimate it; it is never assumed to be zero.
 */
public record Position(
    Body body,
    JulianDate at,
    double longitude,           // degrees, normalized to [0, 360)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Double latitude             // degrees, null = unknown
) {
    public Position {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(at, "at");
        longitude = CircularGeometry.normalize(longitude);
        if (latitude != null && (!Double.isFinite(latitude) || Math.abs(latitude) > 90)) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + latitude);
        }
    }

    /**
     * Position with unknown latitude.
     */
    public Position(Body body, JulianDate at, double longitude) {
        this(body, at, longitude, null);
    }

    @JsonIgnore
    public boolean hasLatitude() {
        return latitude != null;
    }

    @Override
    public String toString() {
        return String.format("%s @ %s: lon=%.4f°, lat=%s", body, at, longitude,
            latitude != null ? String.format("%.4f°", latitude) : "unknown");
    }
}
