package com.symcalc.config;

import java.math.RoundingMode;

/**
 * Configuration constants for numeric evaluation.
 */
public final class EvaluationConfig {

    private EvaluationConfig() {} // Utility class

    /** System property that overrides the result scale */
    public static final String SCALE_PROPERTY = "symcalc.evaluation.scale";

    /** Default number of fractional digits in an evaluation result */
    public static final int DEFAULT_SCALE = 10;

    /** Minimum scale (round to whole numbers) */
    public static final int MIN_SCALE = 0;

    /** Maximum scale; a double carries no more significant fractional digits */
    public static final int MAX_SCALE = 16;

    /** Rounding applied once, to the final result */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_UP;

    /**
     * Largest integer exponent evaluated by repeated multiplication. Larger
     * exponents use {@link Math#pow(double, double)}.
     */
    public static final int MAX_REPEATED_MULTIPLICATIONS = 4096;

    /**
     * Clamp a scale to be within allowed bounds.
     *
     * @param requested the requested scale
     * @return normalized scale within [MIN_SCALE, MAX_SCALE]
     */
    public static int normalizeScale(int requested) {
        if (requested < MIN_SCALE) return MIN_SCALE;
        if (requested > MAX_SCALE) return MAX_SCALE;
        return requested;
    }

    /**
     * Parse a scale setting.
     *
     * @param value the configured value, may be null or blank
     * @return the normalized scale, or DEFAULT_SCALE when unset
     * @throws IllegalArgumentException if value is not an integer
     */
    public static int resolveScale(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_SCALE;
        }
        try {
            return normalizeScale(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid evaluation scale: '%s'. Expected an integer between %d and %d"
                    .formatted(value, MIN_SCALE, MAX_SCALE), e);
        }
    }

    /**
     * Returns the scale configured through {@link #SCALE_PROPERTY}.
     *
     * @return the configured scale, or DEFAULT_SCALE
     */
    public static int configuredScale() {
        return resolveScale(System.getProperty(SCALE_PROPERTY));
    }
}
