package com.almagest.core.provider;

import com.almagest.core.exception.EphemerisException;
import com.almagest.core.exception.PositionUnavailableException;
import com.almagest.core.exception.UnknownBodyException;
import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.Position;
import com.almagest.core.model.PositionResult;

/**
 * Source of ecliptic positions. Implementations range from a first-order analytic model to a
 * live ephemeris service; analytics never need to know which one they are talking to.
 *
 * <p>Each call is independent. A failure is always reported, never papered over with a
 * default or zero position.</p>
 */
public interface PositionProvider {

    /**
     * Short name for logs and error messages, e.g. "analytic" or "horizons".
     */
    String name();

    /**
     * @throws UnknownBodyException         if the provider has no model or data for the body
     * @throws PositionUnavailableException if the body is known but no position can be produced
     * @throws EphemerisException           for any other provider failure
     */
    Position positionOf(Body body, JulianDate at) throws EphemerisException;

    /**
     * Look up a position as a per-item result, so callers processing many bodies or instants
     * can carry on past failures.
     */
    default PositionResult lookup(Body body, JulianDate at) {
        return PositionBatch.lookup(this, body, at);
    }
}
