package com.almagest.ephemeris.config;

import com.almagest.ephemeris.horizons.HorizonsApi;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EphemerisConfigTest {

    @Test
    @DisplayName("Missing file gives defaults")
    void defaults(@TempDir Path dir) throws Exception {
        EphemerisConfig config = EphemerisConfig.load(dir.resolve("missing.yaml"));

        assertEquals("analytic", config.getProvider());
        assertEquals(HorizonsApi.DEFAULT_BASE_URL, config.getHorizons().getBaseUrl());
        assertEquals(HorizonsApi.GEOCENTRIC, config.getHorizons().getCenter());
        assertEquals(10, config.getHorizons().getConnectTimeoutSeconds());
        assertEquals(30, config.getHorizons().getReadTimeoutSeconds());
        assertNull(config.getAnalytic().getElementsPath());
    }

    @Test
    @DisplayName("Partial YAML overrides only what it names")
    void partial(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("ephemeris.yaml");
        Files.writeString(file, String.join("\n",
            "provider: fallback",
            "horizons:",
            "  readTimeoutSeconds: 60",
            "  somethingNew: true",
            ""));

        EphemerisConfig config = EphemerisConfig.load(file);

        assertEquals("fallback", config.getProvider());
        assertEquals(60, config.getHorizons().getReadTimeoutSeconds());
        assertEquals(10, config.getHorizons().getConnectTimeoutSeconds());
        assertEquals(HorizonsApi.GEOCENTRIC, config.getHorizons().getCenter());
    }

    @Test
    @DisplayName("Saved configuration loads back")
    void saveAndLoad(@TempDir Path dir) throws Exception {
        EphemerisConfig config = new EphemerisConfig();
        config.setProvider("horizons");
        config.getHorizons().setCenter("500@10");
        config.getAnalytic().setElementsPath("/tmp/elements.yaml");

        Path file = dir.resolve("nested").resolve("ephemeris.yaml");
        config.save(file);
        EphemerisConfig loaded = EphemerisConfig.load(file);

        assertEquals("horizons", loaded.getProvider());
        assertEquals("500@10", loaded.getHorizons().getCenter());
        assertEquals("/tmp/elements.yaml", loaded.getAnalytic().getElementsPath());
    }
}
