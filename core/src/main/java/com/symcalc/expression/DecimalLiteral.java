package com.symcalc.expression;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Expression representing a decimal constant.
 *
 * <p>The value is held as a {@link BigDecimal}, never as a raw {@code double},
 * so {@code 0.1} stays exactly one tenth until evaluation. Two decimal literals
 * are equal when their values are numerically equal, regardless of scale
 * ({@code 2.50} equals {@code 2.5}).
 */
public final class DecimalLiteral implements Expression {

    private final BigDecimal value;

    /**
     * Creates a decimal literal.
     *
     * @param value the decimal value
     */
    public DecimalLiteral(BigDecimal value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value
     */
    public BigDecimal value() {
        return value;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDecimalLiteral(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DecimalLiteral)) return false;
        DecimalLiteral that = (DecimalLiteral) obj;
        return value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a decimal literal.
     *
     * @param value the value
     * @return the literal expression
     */
    public static DecimalLiteral of(BigDecimal value) {
        return new DecimalLiteral(value);
    }

    /**
     * Creates a decimal literal from its textual form, e.g. {@code "2.75"}.
     *
     * @param value the decimal digits
     * @return the literal expression
     * @throws NumberFormatException if the text is not a valid decimal
     */
    public static DecimalLiteral of(String value) {
        return new DecimalLiteral(new BigDecimal(value));
    }
}
