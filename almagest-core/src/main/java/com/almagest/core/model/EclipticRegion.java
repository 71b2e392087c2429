package com.almagest.core.model;

import com.almagest.core.geometry.CircularGeometry;

import java.util.Objects;

/**
 * A named stretch of ecliptic longitude, running prograde from start to end.
 * The region wraps across 0° when {@code endDeg} is smaller than {@code startDeg}.
 */
public record EclipticRegion(String name, double startDeg, double endDeg) {

    /** Rohini nakshatra, taken generously as 40°-60° (Taurus). */
    public static final EclipticRegion ROHINI = new EclipticRegion("Rohini", 40.0, 60.0);

    public EclipticRegion {
        Objects.requireNonNull(name, "name");
        startDeg = CircularGeometry.normalize(startDeg);
        endDeg = CircularGeometry.normalize(endDeg);
    }

    public Arc arc() {
        return new Arc(startDeg, CircularGeometry.normalize(endDeg - startDeg));
    }

    /**
     * Bounds are inclusive.
     */
    public boolean contains(double longitude) {
        return CircularGeometry.arcContains(arc(), longitude);
    }

    public boolean contains(Position position) {
        return contains(position.longitude());
    }
}
