package com.symcalc.evaluate;

import com.symcalc.config.EvaluationConfig;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Numeric result of evaluating an expression.
 *
 * <p>A finite result is rounded once, to a fixed number of fractional digits
 * with {@link EvaluationConfig#ROUNDING_MODE}, and keeps that scale:
 * {@code 16} evaluates to {@code 16.0000000000} at the default scale of 10.
 *
 * <p>A non-finite result (NaN or an infinity, e.g. from the logarithm of a
 * negative number) is kept as is. It has no decimal form, so
 * {@link #toBigDecimal()} rejects it.
 */
public final class EvaluatedValue {

    private final double value;
    private final BigDecimal decimal;

    private EvaluatedValue(double value, BigDecimal decimal) {
        this.value = value;
        this.decimal = decimal;
    }

    /**
     * Rounds a raw result to the given scale.
     *
     * @param raw the unrounded result
     * @param scale number of fractional digits
     * @return the evaluated value
     */
    public static EvaluatedValue of(double raw, int scale) {
        if (!Double.isFinite(raw)) {
            return new EvaluatedValue(raw, null);
        }
        BigDecimal rounded = BigDecimal.valueOf(raw).setScale(scale, EvaluationConfig.ROUNDING_MODE);
        return new EvaluatedValue(rounded.doubleValue(), rounded);
    }

    /**
     * Returns whether the result is a finite number.
     *
     * @return false for NaN and infinities
     */
    public boolean isFinite() {
        return decimal != null;
    }

    /**
     * Returns the rounded result as a double.
     *
     * @return the value (NaN or infinite for non-finite results)
     */
    public double doubleValue() {
        return value;
    }

    /**
     * Returns the rounded result with its fixed scale.
     *
     * @return the decimal value
     * @throws ArithmeticException if the result is not finite
     */
    public BigDecimal toBigDecimal() {
        if (decimal == null) {
            throw new ArithmeticException("Non-finite result " + value + " has no decimal representation");
        }
        return decimal;
    }

    @Override
    public String toString() {
        return decimal != null ? decimal.toPlainString() : Double.toString(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EvaluatedValue)) return false;
        EvaluatedValue that = (EvaluatedValue) obj;
        if (decimal == null || that.decimal == null) {
            return decimal == that.decimal && Double.compare(value, that.value) == 0;
        }
        return decimal.equals(that.decimal);
    }

    @Override
    public int hashCode() {
        return decimal != null ? decimal.hashCode() : Double.hashCode(value);
    }
}
