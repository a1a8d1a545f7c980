package com.symcalc.expression;

/**
 * Expression representing {@code csc(argument)}, the reciprocal of the sine.
 */
public final class Cosecant extends TrigonometricFunction {

    public Cosecant(Expression argument) {
        super(argument);
    }

    @Override
    public String functionName() {
        return "csc";
    }

    @Override
    public Cosecant withArgument(Expression newArgument) {
        return new Cosecant(newArgument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCosecant(this);
    }
}
