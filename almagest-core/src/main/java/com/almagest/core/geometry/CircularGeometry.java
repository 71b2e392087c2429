package com.almagest.core.geometry;

import com.almagest.core.exception.InsufficientDataException;
import com.almagest.core.model.Arc;

import java.util.Arrays;
import java.util.Collection;

/**
 * Wraparound-safe operations on angles in degrees.
 *
 * <p>Angles are stored normalized to [0, 360). Differences between two angles must go
 * through {@link #signedDelta(double, double)}; raw subtraction breaks at the 0°/360° seam.</p>
 */
public final class CircularGeometry {

    public static final double FULL_CIRCLE = 360.0;
    public static final double HALF_CIRCLE = 180.0;

    /**
     * Slack for closed-arc membership, absorbs rounding of start + length.
     */
    private static final double CONTAINMENT_EPSILON = 1e-9;

    private CircularGeometry() {} // Utility class

    // ========== Normalization ==========

    /**
     * Reduce any finite degree value into [0, 360).
     */
    public static double normalize(double degrees) {
        if (!Double.isFinite(degrees)) {
            throw new IllegalArgumentException("Angle must be finite: " + degrees);
        }
        double r = degrees % FULL_CIRCLE;
        if (r < 0) {
            r += FULL_CIRCLE;
        }
        // -1e-17 + 360 rounds to 360; also folds -0.0
        if (r >= FULL_CIRCLE || r == 0) {
            return 0.0;
        }
        return r;
    }

    // ========== Differences ==========

    /**
     * Shortest signed rotation from {@code from} to {@code to}, in (-180, 180].
     * Positive means increasing longitude (prograde).
     *
     * <p>An exactly antipodal pair gives +180 in both directions. Away from that point the
     * result is exactly antisymmetric: {@code signedDelta(a, b) == -signedDelta(b, a)}.</p>
     */
    public static double signedDelta(double from, double to) {
        double d = (to - from) % FULL_CIRCLE;   // exact, (-360, 360)
        if (d > HALF_CIRCLE) {
            d -= FULL_CIRCLE;
        } else if (d <= -HALF_CIRCLE) {
            d += FULL_CIRCLE;
        }
        if (!Double.isFinite(d)) {
            throw new IllegalArgumentException("Angles must be finite: " + from + ", " + to);
        }
        return d == 0 ? 0.0 : d;
    }

    /**
     * Non-negative shortest arc between two angles, in [0, 180].
     */
    public static double separation(double a, double b) {
        return Math.abs(signedDelta(a, b));
    }

    // ========== Arcs ==========

    /**
     * Smallest contiguous arc containing every angle.
     *
     * <p>The distinct normalized angles are sorted and the circular gaps between neighbours
     * measured, including the wrap from the last angle back to the first. The arc is the
     * complement of the largest gap: it starts at the angle right after that gap and spans
     * {@code 360 - maxGap}. When several gaps tie for largest, the first in ascending order wins.</p>
     *
     * @throws InsufficientDataException if no angles are given
     */
    public static Arc minimalCoveringArc(Collection<Double> angles) {
        double[] values = new double[angles.size()];
        int i = 0;
        for (Double angle : angles) {
            if (angle == null) {
                throw new IllegalArgumentException("Angle at index " + i + " is null");
            }
            values[i++] = angle;
        }
        return minimalCoveringArc(values);
    }

    /**
     * @see #minimalCoveringArc(Collection)
     */
    public static Arc minimalCoveringArc(double... angles) {
        if (angles.length == 0) {
            throw new InsufficientDataException("Minimal covering arc", 1, 0);
        }

        double[] sorted = Arrays.stream(angles)
            .map(CircularGeometry::normalize)
            .sorted()
            .distinct()
            .toArray();
        int n = sorted.length;

        if (n == 1) {
            return new Arc(sorted[0], 0.0);
        }

        int largestGapEnd = 0;
        double largestGap = -1;
        for (int k = 0; k < n; k++) {
            int next = (k + 1) % n;
            double gap = next == 0
                ? sorted[0] + FULL_CIRCLE - sorted[k]
                : sorted[next] - sorted[k];
            if (gap > largestGap) {
                largestGap = gap;
                largestGapEnd = next;
            }
        }

        double length = Math.max(0.0, FULL_CIRCLE - largestGap);
        return new Arc(sorted[largestGapEnd], length);
    }

    /**
     * Check whether an angle lies on a closed arc. A full-circle arc contains everything.
     */
    public static boolean arcContains(Arc arc, double angle) {
        double offset = normalize(normalize(angle) - arc.start());
        return offset <= arc.length() + CONTAINMENT_EPSILON;
    }
}
