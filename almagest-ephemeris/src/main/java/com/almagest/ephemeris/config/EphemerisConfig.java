package com.almagest.ephemeris.config;

import com.almagest.ephemeris.horizons.HorizonsApi;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Which position provider to use and how to reach it.
 *
 * <pre>
 * provider: fallback          # analytic | horizons | fallback
 * horizons:
 *   baseUrl: https://ssd.jpl.nasa.gov/api/horizons.api
 *   center: 500@399
 *   connectTimeoutSeconds: 10
 *   readTimeoutSeconds: 30
 * analytic:
 *   elementsPath: /path/to/mean-elements.yaml   # optional
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EphemerisConfig {

    private String provider = "analytic";
    private HorizonsSettings horizons = new HorizonsSettings();
    private AnalyticSettings analytic = new AnalyticSettings();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public HorizonsSettings getHorizons() { return horizons; }
    public void setHorizons(HorizonsSettings horizons) { this.horizons = horizons; }

    public AnalyticSettings getAnalytic() { return analytic; }
    public void setAnalytic(AnalyticSettings analytic) { this.analytic = analytic; }

    public static EphemerisConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new EphemerisConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), EphemerisConfig.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".almagest", "ephemeris.yaml");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HorizonsSettings {
        private String baseUrl = HorizonsApi.DEFAULT_BASE_URL;
        private String center = HorizonsApi.GEOCENTRIC;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getCenter() { return center; }
        public void setCenter(String center) { this.center = center; }

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int v) { this.connectTimeoutSeconds = v; }

        public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
        public void setReadTimeoutSeconds(int v) { this.readTimeoutSeconds = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnalyticSettings {
        private String elementsPath;

        public String getElementsPath() { return elementsPath; }
        public void setElementsPath(String elementsPath) { this.elementsPath = elementsPath; }
    }
}
