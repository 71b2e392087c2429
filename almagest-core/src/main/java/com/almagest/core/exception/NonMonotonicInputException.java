package com.almagest.core.exception;

import com.almagest.core.model.JulianDate;

/**
 * Thrown when a time series is not strictly increasing in time.
 */
public class NonMonotonicInputException extends AnalyticsException {

    private final int index;

    public NonMonotonicInputException(int index, JulianDate previous, JulianDate current) {
        super(String.format("Sample %d at %s does not follow sample %d at %s",
                index, current, index - 1, previous));
        this.index = index;
    }

    /**
     * Index of the first sample that breaks the ordering.
     */
    public int getIndex() {
        return index;
    }
}
