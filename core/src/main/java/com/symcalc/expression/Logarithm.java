package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing {@code log_base(argument)}.
 *
 * <p>The base is always stored. The single-argument constructor supplies
 * {@link ConstantE} and yields the natural logarithm.
 */
public final class Logarithm implements Expression {

    private final Expression argument;
    private final Expression base;

    /**
     * Creates a logarithm with an explicit base.
     *
     * @param argument the argument
     * @param base the base
     */
    public Logarithm(Expression argument, Expression base) {
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    /**
     * Creates a natural logarithm.
     *
     * @param argument the argument
     */
    public Logarithm(Expression argument) {
        this(argument, ConstantE.get());
    }

    public Expression argument() {
        return argument;
    }

    public Expression base() {
        return base;
    }

    /**
     * Returns whether the base is exactly e.
     *
     * @return true for a natural logarithm
     */
    public boolean isNatural() {
        return base instanceof ConstantE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLogarithm(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Logarithm)) return false;
        Logarithm that = (Logarithm) obj;
        return argument.equals(that.argument) &&
               base.equals(that.base);
    }

    @Override
    public int hashCode() {
        return Objects.hash(argument, base);
    }
}
