package com.symcalc.config;

/**
 * Rendering constants for the expression formatter.
 */
public final class FormatConfig {

    private FormatConfig() {}

    /** Fractional digits kept when rendering a non-integral decimal literal */
    public static final int DECIMAL_DIGITS = 4;

    public static final String RADICAL_SIGN = "√";

    public static final String PI_SYMBOL = "π";

    public static final String E_SYMBOL = "e";

    public static final String IMAGINARY_SYMBOL = "i";
}
