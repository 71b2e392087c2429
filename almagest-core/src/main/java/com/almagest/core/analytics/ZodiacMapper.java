package com.almagest.core.analytics;

import com.almagest.core.geometry.CircularGeometry;
import com.almagest.core.model.ZodiacPosition;
import com.almagest.core.model.ZodiacSign;

/**
 * Maps ecliptic longitude to a zodiac sign and the degree within it.
 *
 * Example: 47.5° -> Taurus 17.5°
 */
public final class ZodiacMapper {

    private static final ZodiacSign[] SIGNS = ZodiacSign.values();

    private ZodiacMapper() {} // Utility class

    public static ZodiacPosition toZodiac(double longitude) {
        double lon = CircularGeometry.normalize(longitude);
        int index = (int) Math.floor(lon / ZodiacSign.SIGN_WIDTH);
        // lon just below 360 can divide up to exactly 12.0
        index = Math.min(index, SIGNS.length - 1);
        double degreeInSign = lon - index * ZodiacSign.SIGN_WIDTH;
        return new ZodiacPosition(SIGNS[index], degreeInSign);
    }

    public static ZodiacSign signOf(double longitude) {
        return toZodiac(longitude).sign();
    }
}
