package com.almagest.core.provider;

import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.PositionResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Samples one body at a fixed cadence, e.g. Mars every 3 days over 90 days to look for
 * retrograde motion. The cadence must respect the motion tracker's sampling precondition.
 */
public final class EphemerisSampler {

    private EphemerisSampler() {} // Utility class

    /**
     * Query {@code count} instants starting at {@code start}, {@code stepDays} apart.
     */
    public static List<PositionResult> sample(PositionProvider provider, Body body,
                                              JulianDate start, double stepDays, int count) {
        if (!Double.isFinite(stepDays) || stepDays <= 0) {
            throw new IllegalArgumentException("Step must be positive: " + stepDays);
        }
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative: " + count);
        }

        List<PositionResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            results.add(provider.lookup(body, start.plusDays(i * stepDays)));
        }
        return results;
    }

    /**
     * Samples covering {@code spanDays} from {@code start}, end exclusive.
     */
    public static List<PositionResult> sampleSpan(PositionProvider provider, Body body,
                                                  JulianDate start, double spanDays, double stepDays) {
        if (!Double.isFinite(stepDays) || stepDays <= 0) {
            throw new IllegalArgumentException("Step must be positive: " + stepDays);
        }
        int count = (int) Math.ceil(spanDays / stepDays);
        return sample(provider, body, start, stepDays, Math.max(count, 0));
    }
}
