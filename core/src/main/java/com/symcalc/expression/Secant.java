package com.symcalc.expression;

/**
 * Expression representing {@code sec(argument)}, the reciprocal of the cosine.
 */
public final class Secant extends TrigonometricFunction {

    public Secant(Expression argument) {
        super(argument);
    }

    @Override
    public String functionName() {
        return "sec";
    }

    @Override
    public Secant withArgument(Expression newArgument) {
        return new Secant(newArgument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSecant(this);
    }
}
