package com.symcalc.expression;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Expression representing an exact integer constant.
 *
 * <p>The value is arbitrary-precision, so integer folding during
 * simplification never overflows.
 *
 * <p>Examples:
 * <pre>
 *   42
 *   -7
 *   123456789012345678901234567890
 * </pre>
 */
public final class IntegerLiteral implements Expression {

    public static final IntegerLiteral ZERO = new IntegerLiteral(BigInteger.ZERO);
    public static final IntegerLiteral ONE = new IntegerLiteral(BigInteger.ONE);
    public static final IntegerLiteral TWO = new IntegerLiteral(BigInteger.TWO);
    public static final IntegerLiteral MINUS_ONE = new IntegerLiteral(BigInteger.ONE.negate());

    private final BigInteger value;

    /**
     * Creates an integer literal.
     *
     * @param value the integer value
     */
    public IntegerLiteral(BigInteger value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value
     */
    public BigInteger value() {
        return value;
    }

    /**
     * Returns whether this literal equals the given integer.
     *
     * @param other the value to compare against
     * @return true if equal
     */
    public boolean isValue(long other) {
        return value.equals(BigInteger.valueOf(other));
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntegerLiteral)) return false;
        IntegerLiteral that = (IntegerLiteral) obj;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an integer literal from a long.
     *
     * @param value the value
     * @return the literal expression
     */
    public static IntegerLiteral of(long value) {
        return new IntegerLiteral(BigInteger.valueOf(value));
    }

    /**
     * Creates an integer literal from a big integer.
     *
     * @param value the value
     * @return the literal expression
     */
    public static IntegerLiteral of(BigInteger value) {
        return new IntegerLiteral(value);
    }
}
