package com.almagest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of a conjunction / eclipse check between two simultaneous positions.
 *
 * <p>{@code nearEcliptic} is null when either latitude is unknown; in that case
 * {@code eclipseLikely} is always false.</p>
 */
public record ConjunctionResult(
    double separation,          // shortest arc in longitude, [0, 180]
    boolean conjunction,
    Boolean nearEcliptic,
    boolean eclipseLikely
) {
    /**
     * True when the latitude test could not be run.
     */
    @JsonIgnore
    public boolean isEclipseIndeterminate() {
        return conjunction && nearEcliptic == null;
    }
}
