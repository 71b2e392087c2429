package com.almagest.ephemeris.horizons;

import com.almagest.core.model.JulianDate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JPL Horizons ephemeris API, observer tables only (no authentication required).
 * Endpoint: GET /api/horizons.api
 *
 * <p>Requests quantity 31 (observer-centered ecliptic longitude and latitude) in CSV form and
 * reads the rows between the {@code $$SOE} and {@code $$EOE} markers of the {@code result} text.</p>
 */
public class HorizonsApi {

    private static final Logger log = LoggerFactory.getLogger(HorizonsApi.class);

    public static final String DEFAULT_BASE_URL = "https://ssd.jpl.nasa.gov/api/horizons.api";
    public static final String GEOCENTRIC = "500@399";

    private static final String START_OF_EPHEMERIS = "$$SOE";
    private static final String END_OF_EPHEMERIS = "$$EOE";
    private static final int MAX_MESSAGE_LENGTH = 240;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;

    public HorizonsApi(OkHttpClient httpClient) {
        this(httpClient, DEFAULT_BASE_URL);
    }

    public HorizonsApi(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Horizons URL: " + baseUrl);
        }
        this.baseUrl = parsed;
    }

    /**
     * Ecliptic longitude and latitude of a target seen from {@code center} at one instant.
     * GET ?COMMAND='499'&CENTER='500@399'&TLIST='2451545.0'&QUANTITIES='31'...
     */
    public EclipticCoordinates getEclipticPosition(String targetCode, String center, JulianDate at)
            throws HorizonsException {
        List<EclipticCoordinates> rows = parseEphemeris(get(buildUrl(targetCode, center, at)));
        if (rows.isEmpty()) {
            throw new HorizonsException("Horizons returned an empty ephemeris for target " + targetCode);
        }
        return rows.get(0);
    }

    HttpUrl buildUrl(String targetCode, String center, JulianDate at) {
        return baseUrl.newBuilder()
            .addQueryParameter("format", "json")
            .addQueryParameter("COMMAND", quoted(targetCode))
            .addQueryParameter("OBJ_DATA", quoted("NO"))
            .addQueryParameter("MAKE_EPHEM", quoted("YES"))
            .addQueryParameter("EPHEM_TYPE", quoted("OBSERVER"))
            .addQueryParameter("CENTER", quoted(center))
            .addQueryParameter("TLIST", quoted(Double.toString(at.jd())))
            .addQueryParameter("TLIST_TYPE", quoted("JD"))
            .addQueryParameter("QUANTITIES", quoted("31"))
            .addQueryParameter("CSV_FORMAT", quoted("YES"))
            .build();
    }

    /**
     * Extract coordinate rows from a Horizons {@code result} text.
     * Each CSV row ends with the longitude and latitude columns.
     */
    static List<EclipticCoordinates> parseEphemeris(String result) throws HorizonsException {
        int start = result.indexOf(START_OF_EPHEMERIS);
        int end = result.indexOf(END_OF_EPHEMERIS);
        if (start < 0 || end < start) {
            // Horizons explains date-range and lookup problems in plain text instead of a table
            throw new HorizonsException("No ephemeris in Horizons response: " + summarize(result));
        }

        List<EclipticCoordinates> rows = new ArrayList<>();
        String block = result.substring(start + START_OF_EPHEMERIS.length(), end);
        for (String line : block.split("\\R")) {
            if (line.isBlank()) continue;

            List<String> fields = new ArrayList<>();
            for (String field : line.split(",")) {
                if (!field.isBlank()) {
                    fields.add(field.trim());
                }
            }
            if (fields.size() < 2) {
                throw new HorizonsException("Malformed ephemeris row: " + line.trim());
            }
            try {
                double longitude = Double.parseDouble(fields.get(fields.size() - 2));
                double latitude = Double.parseDouble(fields.get(fields.size() - 1));
                rows.add(new EclipticCoordinates(longitude, latitude));
            } catch (NumberFormatException e) {
                throw new HorizonsException("Malformed ephemeris row: " + line.trim(), e);
            }
        }
        return rows;
    }

    private String get(HttpUrl url) throws HorizonsException {
        Request request = new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .get()
            .build();

        log.debug("Horizons request: {}", url);
        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new HorizonsException("Horizons request failed: " + response.code() + " "
                    + summarize(responseBody), response.code());
            }

            JsonNode root = mapper.readTree(responseBody);
            if (root.hasNonNull("error")) {
                throw new HorizonsException("Horizons error: " + summarize(root.get("error").asText()));
            }
            JsonNode result = root.get("result");
            if (result == null || !result.isTextual()) {
                throw new HorizonsException("Invalid Horizons response: missing result");
            }
            return result.asText();
        } catch (HorizonsException e) {
            throw e;
        } catch (IOException e) {
            throw new HorizonsException("Horizons request failed: " + e.getMessage(), e);
        }
    }

    private static String quoted(String value) {
        return "'" + value + "'";
    }

    static String summarize(String text) {
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.length() > MAX_MESSAGE_LENGTH
            ? collapsed.substring(0, MAX_MESSAGE_LENGTH) + "..."
            : collapsed;
    }

    /**
     * One parsed ephemeris row.
     */
    public record EclipticCoordinates(double longitude, double latitude) {}
}
