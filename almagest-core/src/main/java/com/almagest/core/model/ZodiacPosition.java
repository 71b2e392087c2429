package com.almagest.core.model;

/**
 * A longitude expressed as a sign and the offset into it.
 */
public record ZodiacPosition(
    ZodiacSign sign,
    double degreeInSign         // [0, 30)
) {
    @Override
    public String toString() {
        return String.format("%s %.1f°", sign.getDisplayName(), degreeInSign);
    }
}
