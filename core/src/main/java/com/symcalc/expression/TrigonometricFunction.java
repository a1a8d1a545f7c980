package com.symcalc.expression;

import java.util.Objects;

/**
 * Base class for the six trigonometric functions of one argument.
 *
 * <p>The set is closed: sin, cos and tan are evaluated directly, while cot,
 * sec and csc are the reciprocals of tan, cos and sin.
 */
public abstract sealed class TrigonometricFunction implements Expression
    permits Sine, Cosine, Tangent, Cotangent, Secant, Cosecant {

    private final Expression argument;

    protected TrigonometricFunction(Expression argument) {
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    /**
     * Returns the function argument.
     *
     * @return the argument expression
     */
    public Expression argument() {
        return argument;
    }

    /**
     * Returns the short function name used in rendering, e.g. {@code "sin"}.
     *
     * @return the function name
     */
    public abstract String functionName();

    /**
     * Returns the same function applied to a different argument.
     *
     * @param newArgument the replacement argument
     * @return a new node of the same kind
     */
    public abstract TrigonometricFunction withArgument(Expression newArgument);

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        TrigonometricFunction that = (TrigonometricFunction) obj;
        return argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName(), argument);
    }
}
