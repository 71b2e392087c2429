package com.almagest.core.exception;

/**
 * Thrown when a computation receives fewer data points than it needs, e.g. an empty set of
 * angles for a covering arc, or a single sample where a direction of motion is required.
 */
public class InsufficientDataException extends AnalyticsException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String what, int required, int actual) {
        super(String.format("%s needs at least %d data point(s), got %d", what, required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
