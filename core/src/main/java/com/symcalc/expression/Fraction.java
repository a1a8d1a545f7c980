package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing a quotient {@code numerator / denominator}.
 *
 * <p>A fraction whose numerator and denominator are both integer literals is a
 * rational number and is reduced to lowest terms by the simplifier. A literal
 * zero denominator is accepted here; the failure is deferred to evaluation.
 */
public final class Fraction implements Expression {

    private final Expression numerator;
    private final Expression denominator;

    /**
     * Creates a fraction.
     *
     * @param numerator the numerator
     * @param denominator the denominator
     */
    public Fraction(Expression numerator, Expression denominator) {
        this.numerator = Objects.requireNonNull(numerator, "numerator must not be null");
        this.denominator = Objects.requireNonNull(denominator, "denominator must not be null");
    }

    public Expression numerator() {
        return numerator;
    }

    public Expression denominator() {
        return denominator;
    }

    /**
     * Returns whether both parts are integer literals.
     *
     * @return true if this fraction is an exact rational
     */
    public boolean isRational() {
        return numerator instanceof IntegerLiteral && denominator instanceof IntegerLiteral;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFraction(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fraction)) return false;
        Fraction that = (Fraction) obj;
        return numerator.equals(that.numerator) &&
               denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }
}
