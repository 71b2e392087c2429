package com.almagest.ephemeris;

import com.almagest.core.exception.EphemerisException;
import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.Position;
import com.almagest.core.provider.PositionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Asks a primary provider first and a secondary one when the primary cannot answer,
 * e.g. Horizons with the analytic model behind it for dates outside Horizons' range.
 */
public class FallbackPositionProvider implements PositionProvider {

    private static final Logger log = LoggerFactory.getLogger(FallbackPositionProvider.class);

    private final PositionProvider primary;
    private final PositionProvider fallback;

    public FallbackPositionProvider(PositionProvider primary, PositionProvider fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public String name() {
        return primary.name() + "+" + fallback.name();
    }

    @Override
    public Position positionOf(Body body, JulianDate at) throws EphemerisException {
        try {
            return primary.positionOf(body, at);
        } catch (EphemerisException primaryFailure) {
            log.info("{} failed for {} at {}, using {}: {}",
                primary.name(), body, at, fallback.name(), primaryFailure.getMessage());
            try {
                return fallback.positionOf(body, at);
            } catch (EphemerisException fallbackFailure) {
                fallbackFailure.addSuppressed(primaryFailure);
                throw fallbackFailure;
            }
        }
    }

    public PositionProvider getPrimary() {
        return primary;
    }

    public PositionProvider getFallback() {
        return fallback;
    }
}
