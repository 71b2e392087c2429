package com.almagest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Apparent direction of motion along the ecliptic between two consecutive samples.
 */
public enum MotionDirection {
    /**
     * Longitude increasing.
     */
    DIRECT("direct"),

    /**
     * Longitude decreasing.
     */
    RETROGRADE("retrograde"),

    /**
     * No change in longitude between the two samples.
     */
    STATIONARY("stationary"),

    /**
     * First sample of a sequence: nothing to compare with.
     */
    UNKNOWN("unknown");

    private final String value;

    MotionDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MotionDirection fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (MotionDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return switch (this) {
            case DIRECT -> "Direct";
            case RETROGRADE -> "Retrograde";
            case STATIONARY -> "Stationary";
            case UNKNOWN -> "N/A";
        };
    }
}
