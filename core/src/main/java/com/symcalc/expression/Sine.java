package com.symcalc.expression;

/**
 * Expression representing {@code sin(argument)}.
 */
public final class Sine extends TrigonometricFunction {

    public Sine(Expression argument) {
        super(argument);
    }

    @Override
    public String functionName() {
        return "sin";
    }

    @Override
    public Sine withArgument(Expression newArgument) {
        return new Sine(newArgument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSine(this);
    }
}
