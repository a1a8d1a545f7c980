package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing the exponentiation {@code base ^ exponent}.
 */
public final class Power implements Expression {

    private final Expression base;
    private final Expression exponent;

    /**
     * Creates a power.
     *
     * @param base the base
     * @param exponent the exponent
     */
    public Power(Expression base, Expression exponent) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.exponent = Objects.requireNonNull(exponent, "exponent must not be null");
    }

    public Expression base() {
        return base;
    }

    public Expression exponent() {
        return exponent;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPower(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Power)) return false;
        Power that = (Power) obj;
        return base.equals(that.base) &&
               exponent.equals(that.exponent);
    }

    @Override
    public int hashCode() {
        return Objects.hash("^", base, exponent);
    }
}
