package com.symcalc.expression;

/**
 * Expression representing {@code tan(argument)}.
 */
public final class Tangent extends TrigonometricFunction {

    public Tangent(Expression argument) {
        super(argument);
    }

    @Override
    public String functionName() {
        return "tan";
    }

    @Override
    public Tangent withArgument(Expression newArgument) {
        return new Tangent(newArgument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTangent(this);
    }
}
