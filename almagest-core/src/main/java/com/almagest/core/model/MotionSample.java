package com.almagest.core.model;

/**
 * One classified point of a body's motion.
 */
public record MotionSample(
    JulianDate at,
    double longitude,
    MotionDirection direction
) {}
