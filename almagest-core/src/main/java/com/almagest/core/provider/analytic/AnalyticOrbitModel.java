package com.almagest.core.provider.analytic;

import com.almagest.core.exception.UnknownBodyException;
import com.almagest.core.geometry.CircularGeometry;
import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.Position;
import com.almagest.core.provider.PositionProvider;

import java.util.Objects;

/**
 * Mean-longitude propagation from a reference epoch:
 * {@code lon = normalize(L0 + n * T)}, T in Julian centuries since the epoch.
 *
 * <p>A first-order approximation that works for any date, far outside the range of live
 * ephemeris services, at the cost of accuracy (no equation of center, no perturbations).
 * Latitude is not estimated and is always reported as unknown.</p>
 */
public class AnalyticOrbitModel implements PositionProvider {

    private final OrbitModelConfig config;

    public AnalyticOrbitModel(OrbitModelConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Model backed by the bundled J2000 constants.
     */
    public static AnalyticOrbitModel j2000() {
        return new AnalyticOrbitModel(OrbitModelConfig.j2000());
    }

    @Override
    public String name() {
        return "analytic";
    }

    public OrbitModelConfig getConfig() {
        return config;
    }

    @Override
    public Position positionOf(Body body, JulianDate at) throws UnknownBodyException {
        Objects.requireNonNull(at, "at");
        MeanElements elements = config.elementsFor(body)
            .orElseThrow(() -> new UnknownBodyException(body, name()));

        double centuries = at.centuriesSince(config.getEpoch());
        double longitude = CircularGeometry.normalize(elements.meanLongitudeAt(centuries));
        return new Position(body, at, longitude);
    }
}
