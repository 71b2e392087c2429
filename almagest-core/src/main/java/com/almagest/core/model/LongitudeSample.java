package com.almagest.core.model;

import com.almagest.core.geometry.CircularGeometry;

import java.util.Objects;

/**
 * A longitude observed at an instant; the input unit of motion tracking.
 */
public record LongitudeSample(JulianDate at, double longitude) {

    public LongitudeSample {
        Objects.requireNonNull(at, "at");
        longitude = CircularGeometry.normalize(longitude);
    }

    public static LongitudeSample of(Position position) {
        return new LongitudeSample(position.at(), position.longitude());
    }
}
