package com.almagest.core.provider.analytic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * First-order orbit description: mean longitude at the reference epoch and its rate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MeanElements(
    double referenceLongitude,          // degrees at epoch
    double meanMotionPerCentury         // degrees per Julian century
) {
    public MeanElements {
        if (!Double.isFinite(referenceLongitude) || !Double.isFinite(meanMotionPerCentury)) {
            throw new IllegalArgumentException("Mean elements must be finite");
        }
    }

    /**
     * Unnormalized mean longitude after {@code centuries} Julian centuries.
     */
    public double meanLongitudeAt(double centuries) {
        return referenceLongitude + meanMotionPerCentury * centuries;
    }
}
