package com.almagest.core.provider.analytic;

import com.almagest.core.model.Body;
import com.almagest.core.model.JulianDate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads mean-element tables from YAML.
 *
 * <pre>
 * epoch: 2451545.0
 * bodies:
 *   Sun:  { referenceLongitude: 280.46646, meanMotionPerCentury: 36000.76983 }
 * </pre>
 *
 * The default table is bundled at {@value #BUNDLED_PATH}.
 */
public final class OrbitModelConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(OrbitModelConfigLoader.class);

    public static final String BUNDLED_PATH = "/orbits/mean-elements.yaml";

    private static final YAMLMapper yamlMapper = new YAMLMapper();

    private OrbitModelConfigLoader() {} // Utility class

    public static OrbitModelConfig loadBundled() {
        try (InputStream is = OrbitModelConfigLoader.class.getResourceAsStream(BUNDLED_PATH)) {
            if (is == null) {
                throw new IllegalStateException("Bundled orbit elements not found at " + BUNDLED_PATH);
            }
            return parse(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled orbit elements", e);
        }
    }

    public static OrbitModelConfig load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            OrbitModelConfig config = parse(is);
            log.info("Loaded mean elements for {} bodies from {}", config.getBodies().size(), path);
            return config;
        }
    }

    public static OrbitModelConfig parse(InputStream is) throws IOException {
        ElementsFile file = yamlMapper.readValue(is, ElementsFile.class);
        if (file.epoch == null) {
            throw new IOException("Orbit elements file has no epoch");
        }
        Map<Body, MeanElements> elements = new LinkedHashMap<>();
        if (file.bodies != null) {
            file.bodies.forEach((name, meanElements) -> elements.put(Body.of(name), meanElements));
        }
        return new OrbitModelConfig(JulianDate.of(file.epoch), elements);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ElementsFile {
        public Double epoch;
        public LinkedHashMap<String, MeanElements> bodies;
    }
}
