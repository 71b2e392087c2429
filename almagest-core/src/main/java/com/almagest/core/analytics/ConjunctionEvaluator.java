package com.almagest.core.analytics;

import com.almagest.core.geometry.CircularGeometry;
import com.almagest.core.model.ConjunctionResult;
import com.almagest.core.model.Position;

import java.util.Objects;

/**
 * Conjunction and eclipse-likelihood check between two simultaneous positions,
 * typically the Sun and the Moon.
 *
 * <p>Eclipse conditions: the bodies are in conjunction (separation in longitude below the
 * conjunction threshold) and the second body is near the ecliptic (|latitude| below the
 * latitude threshold). The latitude test only runs when both latitudes are known; an unknown
 * latitude leaves {@code nearEcliptic} null and the eclipse flag false.</p>
 */
public class ConjunctionEvaluator {

    /** New Moon window used for solar eclipse screening. */
    public static final double DEFAULT_CONJUNCTION_THRESHOLD_DEG = 15.0;

    /** Lunar latitude below which a conjunction can produce an eclipse. */
    public static final double DEFAULT_LATITUDE_THRESHOLD_DEG = 1.5;

    private final double conjunctionThresholdDeg;
    private final double latitudeThresholdDeg;

    public ConjunctionEvaluator() {
        this(DEFAULT_CONJUNCTION_THRESHOLD_DEG, DEFAULT_LATITUDE_THRESHOLD_DEG);
    }

    public ConjunctionEvaluator(double conjunctionThresholdDeg, double latitudeThresholdDeg) {
        this.conjunctionThresholdDeg = requirePositive(conjunctionThresholdDeg, "conjunction threshold");
        this.latitudeThresholdDeg = requirePositive(latitudeThresholdDeg, "latitude threshold");
    }

    public double getConjunctionThresholdDeg() {
        return conjunctionThresholdDeg;
    }

    public double getLatitudeThresholdDeg() {
        return latitudeThresholdDeg;
    }

    public ConjunctionResult evaluate(Position a, Position b) {
        return evaluate(a, b, conjunctionThresholdDeg, latitudeThresholdDeg);
    }

    public static ConjunctionResult evaluate(Position a, Position b,
                                             double conjunctionThresholdDeg,
                                             double latitudeThresholdDeg) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        requirePositive(conjunctionThresholdDeg, "conjunction threshold");
        requirePositive(latitudeThresholdDeg, "latitude threshold");
        if (!a.at().equals(b.at())) {
            throw new IllegalArgumentException(
                "Positions must be simultaneous: " + a.at() + " vs " + b.at());
        }

        double separation = CircularGeometry.separation(a.longitude(), b.longitude());
        boolean conjunction = separation < conjunctionThresholdDeg;

        Boolean nearEcliptic = null;
        if (a.hasLatitude() && b.hasLatitude()) {
            nearEcliptic = Math.abs(b.latitude()) < latitudeThresholdDeg;
        }

        boolean eclipseLikely = conjunction && Boolean.TRUE.equals(nearEcliptic);
        return new ConjunctionResult(separation, conjunction, nearEcliptic, eclipseLikely);
    }

    private static double requirePositive(double value, String what) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new IllegalArgumentException("The " + what + " must be positive: " + value);
        }
        return value;
    }
}
