package com.almagest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * A point on the Julian Date time axis (continuous days, UT).
 */
public record JulianDate(double jd) implements Comparable<JulianDate> {

    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    /** JD of the Unix epoch, 1970-01-01T00:00Z. */
    public static final double UNIX_EPOCH_JD = 2440587.5;

    /** J2000.0, 2000-01-01T12:00 TT. */
    public static final JulianDate J2000 = new JulianDate(2451545.0);

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    public JulianDate {
        if (!Double.isFinite(jd)) {
            throw new IllegalArgumentException("Julian date must be finite: " + jd);
        }
    }

    @JsonCreator
    public static JulianDate of(double jd) {
        return new JulianDate(jd);
    }

    public static JulianDate fromInstant(Instant instant) {
        return new JulianDate(UNIX_EPOCH_JD + instant.toEpochMilli() / MILLIS_PER_DAY);
    }

    @JsonValue
    @Override
    public double jd() {
        return jd;
    }

    public double daysSince(JulianDate other) {
        return jd - other.jd;
    }

    public double centuriesSince(JulianDate epoch) {
        return daysSince(epoch) / DAYS_PER_JULIAN_CENTURY;
    }

    public JulianDate plusDays(double days) {
        return new JulianDate(jd + days);
    }

    public boolean isBefore(JulianDate other) {
        return jd < other.jd;
    }

    public boolean isAfter(JulianDate other) {
        return jd > other.jd;
    }

    @Override
    public int compareTo(JulianDate other) {
        return Double.compare(jd, other.jd);
    }

    @Override
    public String toString() {
        return "JD " + jd;
    }
}
