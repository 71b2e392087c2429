package com.almagest.ephemeris.horizons;

import com.almagest.core.exception.PositionUnavailableException;
import com.almagest.core.exception.UnknownBodyException;
import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.Position;
import com.almagest.core.provider.PositionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Precise positions from JPL Horizons. Coverage is limited in time (roughly 3000 BCE onward
 * for most bodies); requests outside it fail as unavailable.
 */
public class HorizonsPositionProvider implements PositionProvider {

    private static final Logger log = LoggerFactory.getLogger(HorizonsPositionProvider.class);

    private final HorizonsApi api;
    private final HorizonsBodyCatalog catalog;
    private final String center;

    public HorizonsPositionProvider(HorizonsApi api) {
        this(api, HorizonsBodyCatalog.defaults(), HorizonsApi.GEOCENTRIC);
    }

    public HorizonsPositionProvider(HorizonsApi api, HorizonsBodyCatalog catalog, String center) {
        this.api = Objects.requireNonNull(api, "api");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.center = Objects.requireNonNull(center, "center");
    }

    @Override
    public String name() {
        return "horizons";
    }

    @Override
    public Position positionOf(Body body, JulianDate at) throws UnknownBodyException, PositionUnavailableException {
        String code = catalog.codeFor(body)
            .orElseThrow(() -> new UnknownBodyException(body, name()));

        try {
            HorizonsApi.EclipticCoordinates coords = api.getEclipticPosition(code, center, at);
            log.debug("{} ({}) at {}: lon={}, lat={}", body, code, at, coords.longitude(), coords.latitude());
            return new Position(body, at, coords.longitude(), coords.latitude());
        } catch (HorizonsException e) {
            throw new PositionUnavailableException(body, at, e.getMessage(), e);
        }
    }
}
