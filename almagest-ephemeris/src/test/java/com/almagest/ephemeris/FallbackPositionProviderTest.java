package com.almagest.ephemeris;

import com.almagest.core.exception.EphemerisException;
import com.almagest.core.exception.PositionUnavailableException;
import com.almagest.core.exception.UnknownBodyException;
import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.almagest.core.model.Position;
import com.almagest.core.provider.PositionProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FallbackPositionProviderTest {

    private static final JulianDate ANCIENT = JulianDate.of(260649.5);

    private static PositionProvider fixed(String name, double longitude) {
        return new PositionProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Position positionOf(Body body, JulianDate at) {
                return new Position(body, at, longitude);
            }
        };
    }

    private static PositionProvider failing(String name, boolean unknown) {
        return new PositionProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Position positionOf(Body body, JulianDate at) throws EphemerisException {
                if (unknown) {
                    throw new UnknownBodyException(body, name);
                }
                throw new PositionUnavailableException(body, at, "outside coverage");
            }
        };
    }

    @Test
    @DisplayName("Primary answer is used when available")
    void primaryFirst() throws Exception {
        FallbackPositionProvider provider = new FallbackPositionProvider(fixed("live", 10), fixed("model", 20));

        assertEquals(10.0, provider.positionOf(Body.MARS, ANCIENT).longitude());
        assertEquals("live+model", provider.name());
    }

    @Test
    @DisplayName("Fallback answers when the primary cannot")
    void fallback() throws Exception {
        FallbackPositionProvider provider = new FallbackPositionProvider(failing("live", false), fixed("model", 20));

        Position mars = provider.positionOf(Body.MARS, ANCIENT);

        assertEquals(20.0, mars.longitude());
        assertEquals(ANCIENT, mars.at());
    }

    @Test
    @DisplayName("When both fail, the fallback error is thrown with the primary one attached")
    void bothFail() {
        FallbackPositionProvider provider = new FallbackPositionProvider(
            failing("live", false), failing("model", true));

        UnknownBodyException e = assertThrows(UnknownBodyException.class,
            () -> provider.positionOf(Body.of("Pluto"), ANCIENT));
        assertEquals(1, e.getSuppressed().length);
        assertInstanceOf(PositionUnavailableException.class, e.getSuppressed()[0]);
    }
}
