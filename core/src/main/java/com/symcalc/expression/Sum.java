package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing the addition {@code left + right}.
 *
 * <p>Subtraction has no node of its own; {@code a - b} is built as
 * {@code a + (-1 * b)}.
 */
public final class Sum implements Expression {

    private final Expression left;
    private final Expression right;

    /**
     * Creates a sum.
     *
     * @param left the left operand
     * @param right the right operand
     */
    public Sum(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSum(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sum)) return false;
        Sum that = (Sum) obj;
        return left.equals(that.left) &&
               right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("+", left, right);
    }
}
