package com.almagest.core.analytics;

import com.almagest.core.exception.InsufficientDataException;
import com.almagest.core.geometry.CircularGeometry;
import com.almagest.core.model.Arc;
import com.almagest.core.model.Body;
import com.almagest.core.model.ClusterResult;
import com.almagest.core.model.Position;
import com.almagest.core.model.PositionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups simultaneous positions of distinct bodies by the smallest arc of the ecliptic that
 * holds all of them. Unlike a max-minus-min span, the result does not depend on where the
 * 0°/360° seam falls: bodies at 359° and 1° are 2° apart.
 */
public final class ClusterAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ClusterAnalyzer.class);

    /** Half the ecliptic: "all planets within six signs". */
    public static final double SIX_SIGNS_DEG = 180.0;

    private ClusterAnalyzer() {} // Utility class

    /**
     * @throws InsufficientDataException if no positions are given
     * @throws IllegalArgumentException  if a body appears more than once
     */
    public static ClusterResult analyze(Collection<Position> positions) {
        return analyze(positions, List.of());
    }

    /**
     * Longitudes keyed by body; a map cannot hold duplicates.
     */
    public static ClusterResult analyzeLongitudes(Map<Body, Double> longitudes) {
        Arc arc = CircularGeometry.minimalCoveringArc(longitudes.values());
        return new ClusterResult(arc, new ArrayList<>(longitudes.keySet()));
    }

    /**
     * Cluster the available items of a batch lookup and record the bodies that had to be left out.
     *
     * @throws InsufficientDataException if no item has a position
     */
    public static ClusterResult analyzeAvailable(List<PositionResult> results) {
        List<Position> available = new ArrayList<>();
        List<Body> skipped = new ArrayList<>();
        for (PositionResult result : results) {
            if (result.isAvailable()) {
                available.add(result.position());
            } else {
                skipped.add(result.body());
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("Clustering without {} unavailable bodies: {}", skipped.size(), skipped);
        }
        return analyze(available, skipped);
    }

    private static ClusterResult analyze(Collection<Position> positions, List<Body> skipped) {
        if (positions.isEmpty()) {
            throw new InsufficientDataException("Cluster analysis", 1, 0);
        }

        Set<Body> bodies = new LinkedHashSet<>();
        List<Double> longitudes = new ArrayList<>(positions.size());
        for (Position p : positions) {
            if (!bodies.add(p.body())) {
                throw new IllegalArgumentException("Duplicate body in cluster: " + p.body());
            }
            longitudes.add(p.longitude());
        }

        Arc arc = CircularGeometry.minimalCoveringArc(longitudes);
        log.debug("Cluster of {} bodies spans {}", bodies.size(), arc);
        return new ClusterResult(arc, new ArrayList<>(bodies), skipped);
    }
}
