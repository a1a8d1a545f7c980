package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing the root {@code degree√radicand}.
 *
 * <p>The degree is always stored. The single-argument constructor supplies
 * the integer literal 2 and yields a square root.
 */
public final class Radical implements Expression {

    private final Expression radicand;
    private final Expression degree;

    /**
     * Creates a radical with an explicit degree.
     *
     * @param radicand the radicand
     * @param degree the root degree
     */
    public Radical(Expression radicand, Expression degree) {
        this.radicand = Objects.requireNonNull(radicand, "radicand must not be null");
        this.degree = Objects.requireNonNull(degree, "degree must not be null");
    }

    /**
     * Creates a square root.
     *
     * @param radicand the radicand
     */
    public Radical(Expression radicand) {
        this(radicand, IntegerLiteral.TWO);
    }

    public Expression radicand() {
        return radicand;
    }

    public Expression degree() {
        return degree;
    }

    /**
     * Returns whether the degree is exactly the integer literal 2.
     *
     * @return true for a square root
     */
    public boolean isSquareRoot() {
        return IntegerLiteral.TWO.equals(degree);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRadical(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Radical)) return false;
        Radical that = (Radical) obj;
        return radicand.equals(that.radicand) &&
               degree.equals(that.degree);
    }

    @Override
    public int hashCode() {
        return Objects.hash(radicand, degree);
    }
}
