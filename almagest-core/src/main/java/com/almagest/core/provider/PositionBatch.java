package com.almagest.core.provider;

import com.almagest.core.exception.EphemerisException;
import com.almagest.core.exception.UnknownBodyException;
import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.Position;
import com.almagest.core.model.PositionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Positions of several bodies at one instant.
 */
public final class PositionBatch {

    private static final Logger log = LoggerFactory.getLogger(PositionBatch.class);

    private PositionBatch() {} // Utility class

    /**
     * Single lookup converted to a per-item result.
     */
    public static PositionResult lookup(PositionProvider provider, Body body, JulianDate at) {
        try {
            return PositionResult.ok(provider.positionOf(body, at));
        } catch (UnknownBodyException e) {
            log.warn("{}: {}", provider.name(), e.getMessage());
            return PositionResult.failed(body, at, PositionResult.Failure.UNKNOWN_BODY, e.getMessage());
        } catch (EphemerisException e) {
            log.warn("{}: {}", provider.name(), e.getMessage());
            return PositionResult.failed(body, at, PositionResult.Failure.UNAVAILABLE, e.getMessage());
        }
    }

    /**
     * One result per body, in the order given. Failed lookups stay in the list as failures.
     */
    public static List<PositionResult> snapshot(PositionProvider provider, List<Body> bodies, JulianDate at) {
        List<PositionResult> results = new ArrayList<>(bodies.size());
        for (Body body : bodies) {
            results.add(provider.lookup(body, at));
        }
        long failed = results.stream().filter(r -> !r.isAvailable()).count();
        log.debug("Snapshot of {} bodies at {} from {}: {} failed", bodies.size(), at, provider.name(), failed);
        return results;
    }

    /**
     * Only the positions that could be produced.
     */
    public static List<Position> available(List<PositionResult> results) {
        return results.stream()
            .filter(PositionResult::isAvailable)
            .map(PositionResult::position)
            .toList();
    }

    public static boolean allFailed(List<PositionResult> results) {
        return results.stream().noneMatch(PositionResult::isAvailable);
    }
}
