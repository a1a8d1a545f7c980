package com.symcalc.expression;

/**
 * Expression representing {@code cos(argument)}.
 */
public final class Cosine extends TrigonometricFunction {

    public Cosine(Expression argument) {
        super(argument);
    }

    @Override
    public String functionName() {
        return "cos";
    }

    @Override
    public Cosine withArgument(Expression newArgument) {
        return new Cosine(newArgument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCosine(this);
    }
}
