package com.almagest.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for value invariants and JSON shape of the model records.
 */
class ModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("Position longitude is normalized")
        void positionNormalized() {
            Position p = new Position(Body.MARS, JulianDate.J2000, -10);

            assertEquals(350.0, p.longitude(), 1e-9);
            assertFalse(p.hasLatitude());
        }

        @Test
        @DisplayName("Position latitude beyond the poles is rejected")
        void latitudeRange() {
            assertThrows(IllegalArgumentException.class,
                () -> new Position(Body.MOON, JulianDate.J2000, 0, 91.0));
            assertDoesNotThrow(() -> new Position(Body.MOON, JulianDate.J2000, 0, -90.0));
        }

        @Test
        @DisplayName("Body names must not be blank")
        void bodyName() {
            assertThrows(IllegalArgumentException.class, () -> Body.of("  "));
            assertEquals(Body.MARS, Body.of("Mars"));
        }

        @Test
        @DisplayName("Arc length is limited to a full circle")
        void arcLength() {
            assertThrows(IllegalArgumentException.class, () -> new Arc(0, -1));
            assertThrows(IllegalArgumentException.class, () -> new Arc(0, 360.5));
            assertEquals(5.0, new Arc(355, 10).end(), 1e-9);
        }

        @Test
        @DisplayName("A result carries either a position or a failure")
        void positionResult() {
            Position p = new Position(Body.SUN, JulianDate.J2000, 1);

            assertThrows(IllegalArgumentException.class,
                () -> new PositionResult(Body.SUN, JulianDate.J2000, null, null, null));
            assertThrows(IllegalArgumentException.class,
                () -> new PositionResult(Body.SUN, JulianDate.J2000, p, PositionResult.Failure.UNAVAILABLE, "x"));
        }

        @Test
        @DisplayName("Retrograde interval reports backward travel across the seam")
        void retrogradeArc() {
            RetrogradeInterval interval = new RetrogradeInterval(
                JulianDate.of(10), JulianDate.of(40), 2.0, 355.0);

            assertEquals(30.0, interval.durationDays(), 1e-9);
            assertEquals(7.0, interval.arcTravelled(), 1e-9);
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("Body and instant serialize as scalars, unknown latitude is omitted")
        void position() throws Exception {
            JsonNode node = mapper.valueToTree(new Position(Body.SUN, JulianDate.J2000, 280.5));

            assertEquals("Sun", node.get("body").asText());
            assertEquals(2451545.0, node.get("at").asDouble());
            assertEquals(280.5, node.get("longitude").asDouble());
            assertFalse(node.has("latitude"));
            assertFalse(node.has("hasLatitude"));
        }

        @Test
        @DisplayName("Failed result has no position field")
        void failedResult() {
            PositionResult failed = PositionResult.failed(Body.MOON, JulianDate.J2000,
                PositionResult.Failure.UNAVAILABLE, "timeout");

            JsonNode node = mapper.valueToTree(failed);

            assertEquals("UNAVAILABLE", node.get("failure").asText());
            assertFalse(node.has("position"));
            assertFalse(node.has("available"));
        }

        @Test
        @DisplayName("Direction serializes to its lowercase value")
        void direction() throws Exception {
            assertEquals("\"retrograde\"", mapper.writeValueAsString(MotionDirection.RETROGRADE));
            assertEquals(MotionDirection.DIRECT, mapper.readValue("\"Direct\"", MotionDirection.class));
        }

        @Test
        @DisplayName("Body reads back from a plain string")
        void bodyFromString() throws Exception {
            assertEquals(Body.JUPITER, mapper.readValue("\"Jupiter\"", Body.class));
        }
    }
}
