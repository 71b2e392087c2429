package com.almagest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Tightest grouping of a set of simultaneous positions on the ecliptic.
 *
 * @param arc     minimal arc covering every included body
 * @param bodies  bodies that took part in the computation
 * @param skipped bodies left out because their position was unavailable
 */
public record ClusterResult(
    Arc arc,
    List<Body> bodies,
    List<Body> skipped
) {
    public ClusterResult {
        bodies = List.copyOf(bodies);
        skipped = List.copyOf(skipped);
    }

    public ClusterResult(Arc arc, List<Body> bodies) {
        this(arc, bodies, List.of());
    }

    /**
     * Check whether all included bodies fit within {@code thresholdDeg} of arc.
     */
    public boolean withinDeg(double thresholdDeg) {
        return arc.length() <= thresholdDeg;
    }

    @JsonIgnore
    public boolean isComplete() {
        return skipped.isEmpty();
    }
}
