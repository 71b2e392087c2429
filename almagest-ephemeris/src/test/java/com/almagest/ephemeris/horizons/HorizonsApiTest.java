package com.almagest.ephemeris.horizons;

import com.almagest.core.model.JulianDate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Horizons request building and response parsing. HTTP is answered by an
 * interceptor, so nothing leaves the machine.
 */
class HorizonsApiTest {

    static final String MARS_RESULT = String.join("\n",
        "*******************************************************************************",
        "Target body name: Mars (499)                      {source: mar097}",
        "Center body name: Earth (399)                     {source: DE441}",
        "*******************************************************************************",
        " Date__(UT)__HR:MN, , , ObsEcLon, ObsEcLat,",
        "***************************************************",
        "$$SOE",
        " 2000-Jan-01 12:00, , ,  327.9631413, -1.0668591,",
        "$$EOE",
        "***************************************************",
        "");

    static String json(String result) {
        ObjectNode root = new ObjectMapper().createObjectNode();
        root.putObject("signature").put("source", "NASA/JPL Horizons API").put("version", "1.2");
        root.put("result", result);
        return root.toString();
    }

    static OkHttpClient answering(int code, String body, AtomicReference<HttpUrl> seen) {
        Interceptor interceptor = chain -> {
            if (seen != null) {
                seen.set(chain.request().url());
            }
            return new Response.Builder()
                .request(chain.request())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code == 200 ? "OK" : "Error")
                .body(ResponseBody.create(body, MediaType.get("application/json")))
                .build();
        };
        return new OkHttpClient.Builder().addInterceptor(interceptor).build();
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Longitude and latitude are the last two columns")
        void parsesRow() throws Exception {
            List<HorizonsApi.EclipticCoordinates> rows = HorizonsApi.parseEphemeris(MARS_RESULT);

            assertEquals(1, rows.size());
            assertEquals(327.9631413, rows.get(0).longitude(), 1e-9);
            assertEquals(-1.0668591, rows.get(0).latitude(), 1e-9);
        }

        @Test
        @DisplayName("Several rows are returned in order")
        void multipleRows() throws Exception {
            String result = "$$SOE\n 2000-Jan-01 12:00, , , 10.5, 0.1,\n\n 2000-Jan-04 12:00, , , 12.25, 0.2,\n$$EOE\n";

            List<HorizonsApi.EclipticCoordinates> rows = HorizonsApi.parseEphemeris(result);

            assertEquals(2, rows.size());
            assertEquals(12.25, rows.get(1).longitude());
        }

        @Test
        @DisplayName("Text without a table is reported with its explanation")
        void noEphemeris() {
            String result = "No ephemeris for target \"Mars\" prior to A.D. 1600-JAN-01 00:00:00.0000 TDB\n";

            HorizonsException e = assertThrows(HorizonsException.class, () -> HorizonsApi.parseEphemeris(result));
            assertTrue(e.getMessage().startsWith("No ephemeris in Horizons response"));
            assertTrue(e.getMessage().contains("prior to A.D. 1600"));
        }

        @Test
        @DisplayName("Rows that are not numbers are malformed")
        void malformed() {
            String result = "$$SOE\n 2000-Jan-01 12:00, , , n.a., n.a.,\n$$EOE";

            HorizonsException e = assertThrows(HorizonsException.class, () -> HorizonsApi.parseEphemeris(result));
            assertTrue(e.getMessage().startsWith("Malformed ephemeris row"));
            assertInstanceOf(NumberFormatException.class, e.getCause());
        }

        @Test
        @DisplayName("Long messages are collapsed and truncated")
        void summarize() {
            String text = "a  b\n\nc" + "x".repeat(500);

            String summary = HorizonsApi.summarize(text);

            assertTrue(summary.startsWith("a b c"));
            assertTrue(summary.endsWith("..."));
            assertEquals(243, summary.length());
        }
    }

    @Nested
    @DisplayName("Requests")
    class Requests {

        @Test
        @DisplayName("Observer table for one instant with quantity 31")
        void queryParameters() {
            HorizonsApi api = new HorizonsApi(new OkHttpClient());

            HttpUrl url = api.buildUrl("499", HorizonsApi.GEOCENTRIC, JulianDate.J2000);

            assertEquals("ssd.jpl.nasa.gov", url.host());
            assertEquals("json", url.queryParameter("format"));
            assertEquals("'499'", url.queryParameter("COMMAND"));
            assertEquals("'500@399'", url.queryParameter("CENTER"));
            assertEquals("'2451545.0'", url.queryParameter("TLIST"));
            assertEquals("'JD'", url.queryParameter("TLIST_TYPE"));
            assertEquals("'OBSERVER'", url.queryParameter("EPHEM_TYPE"));
            assertEquals("'31'", url.queryParameter("QUANTITIES"));
            assertEquals("'YES'", url.queryParameter("CSV_FORMAT"));
        }

        @Test
        @DisplayName("Invalid base URL is rejected")
        void invalidBaseUrl() {
            assertThrows(IllegalArgumentException.class, () -> new HorizonsApi(new OkHttpClient(), "not a url"));
        }
    }

    @Nested
    @DisplayName("Responses")
    class Responses {

        @Test
        @DisplayName("Successful response yields the coordinates")
        void success() throws Exception {
            AtomicReference<HttpUrl> seen = new AtomicReference<>();
            HorizonsApi api = new HorizonsApi(answering(200, json(MARS_RESULT), seen), "http://horizons.test/api");

            HorizonsApi.EclipticCoordinates coords = api.getEclipticPosition("499", "500@399", JulianDate.J2000);

            assertEquals(327.9631413, coords.longitude(), 1e-9);
            assertEquals("horizons.test", seen.get().host());
            assertEquals("'499'", seen.get().queryParameter("COMMAND"));
        }

        @Test
        @DisplayName("HTTP errors keep their status code")
        void httpError() {
            HorizonsApi api = new HorizonsApi(answering(503, "Service Unavailable", null));

            HorizonsException e = assertThrows(HorizonsException.class,
                () -> api.getEclipticPosition("499", "500@399", JulianDate.J2000));
            assertEquals(503, e.getHttpStatus());
        }

        @Test
        @DisplayName("Error field in the JSON body is reported")
        void errorField() {
            String body = "{\"error\":\"Cannot interpret date. Type \\\"?!\\\" for help.\"}";
            HorizonsApi api = new HorizonsApi(answering(200, body, null));

            HorizonsException e = assertThrows(HorizonsException.class,
                () -> api.getEclipticPosition("499", "500@399", JulianDate.J2000));
            assertTrue(e.getMessage().startsWith("Horizons error: Cannot interpret date"));
            assertEquals(-1, e.getHttpStatus());
        }

        @Test
        @DisplayName("Missing result is invalid")
        void missingResult() {
            HorizonsApi api = new HorizonsApi(answering(200, "{\"signature\":{}}", null));

            HorizonsException e = assertThrows(HorizonsException.class,
                () -> api.getEclipticPosition("499", "500@399", JulianDate.J2000));
            assertEquals("Invalid Horizons response: missing result", e.getMessage());
        }

        @Test
        @DisplayName("Empty table is an error, not a zero position")
        void emptyTable() {
            HorizonsApi api = new HorizonsApi(answering(200, json("$$SOE\n$$EOE\n"), null));

            assertThrows(HorizonsException.class,
                () -> api.getEclipticPosition("499", "500@399", JulianDate.J2000));
        }

        @Test
        @DisplayName("Network failures are wrapped")
        void networkFailure() {
            OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    throw new IOException("connection reset");
                })
                .build();
            HorizonsApi api = new HorizonsApi(client);

            HorizonsException e = assertThrows(HorizonsException.class,
                () -> api.getEclipticPosition("499", "500@399", JulianDate.J2000));
            assertInstanceOf(IOException.class, e.getCause());
            assertTrue(e.getMessage().contains("connection reset"));
        }
    }
}
