package com.almagest.core.model;

/**
 * The twelve 30° sectors of ecliptic longitude, starting at 0° (Aries).
 */
public enum ZodiacSign {
    ARIES("Aries"),
    TAURUS("Taurus"),
    GEMINI("Gemini"),
    CANCER("Cancer"),
    LEO("Leo"),
    VIRGO("Virgo"),
    LIBRA("Libra"),
    SCORPIO("Scorpio"),
    SAGITTARIUS("Sagittarius"),
    CAPRICORN("Capricorn"),
    AQUARIUS("Aquarius"),
    PISCES("Pisces");

    public static final double SIGN_WIDTH = 30.0;

    private final String displayName;

    ZodiacSign(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Longitude where this sign begins.
     */
    public double startLongitude() {
        return ordinal() * SIGN_WIDTH;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
