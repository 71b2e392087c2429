package com.almagest.ephemeris;

import com.almagest.core.exception.EphemerisException;
import com.almagest.core.provider.PositionProvider;
import com.almagest.core.provider.analytic.AnalyticOrbitModel;
import com.almagest.core.provider.analytic.OrbitModelConfig;
import com.almagest.core.provider.analytic.OrbitModelConfigLoader;
import com.almagest.ephemeris.config.EphemerisConfig;
import com.almagest.ephemeris.horizons.HorizonsApi;
import com.almagest.ephemeris.horizons.HorizonsBodyCatalog;
import com.almagest.ephemeris.horizons.HorizonsPositionProvider;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class PositionProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(PositionProviderFactory.class);

    public static PositionProvider create(EphemerisConfig config) throws EphemerisException {
        String provider = config.getProvider() == null ? "" : config.getProvider().trim().toLowerCase(Locale.ROOT);

        PositionProvider created = switch (provider) {
            case "analytic" -> analytic(config.getAnalytic());
            case "horizons" -> horizons(config.getHorizons());
            case "fallback" -> new FallbackPositionProvider(
                horizons(config.getHorizons()), analytic(config.getAnalytic()));
            default -> throw new EphemerisException("Unsupported position provider: " + config.getProvider());
        };
        log.info("Using position provider: {}", created.name());
        return created;
    }

    static AnalyticOrbitModel analytic(EphemerisConfig.AnalyticSettings settings) throws EphemerisException {
        String elementsPath = settings.getElementsPath();
        if (elementsPath == null || elementsPath.isBlank()) {
            return new AnalyticOrbitModel(OrbitModelConfig.j2000());
        }
        try {
            return new AnalyticOrbitModel(OrbitModelConfigLoader.load(Path.of(elementsPath)));
        } catch (IOException e) {
            throw new EphemerisException("Failed to load orbit elements from " + elementsPath, e);
        }
    }

    static HorizonsPositionProvider horizons(EphemerisConfig.HorizonsSettings settings) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(settings.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(settings.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
        HorizonsApi api = new HorizonsApi(httpClient, settings.getBaseUrl());
        return new HorizonsPositionProvider(api, HorizonsBodyCatalog.defaults(), settings.getCenter());
    }
}
