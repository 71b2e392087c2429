package com.almagest.core.model;

import com.almagest.core.geometry.CircularGeometry;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A contiguous stretch of retrograde motion, bounded by the samples on either side of it.
 */
public record RetrogradeInterval(
    JulianDate start,
    JulianDate end,
    double startLongitude,
    double endLongitude
) {
    @JsonIgnore
    public double durationDays() {
        return end.daysSince(start);
    }

    /**
     * Degrees travelled backwards over the interval (positive).
     */
    @JsonIgnore
    public double arcTravelled() {
        return -CircularGeometry.signedDelta(startLongitude, endLongitude);
    }
}
