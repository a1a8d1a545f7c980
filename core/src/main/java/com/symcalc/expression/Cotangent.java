package com.symcalc.expression;

/**
 * Expression representing {@code cot(argument)}, the reciprocal of the tangent.
 */
public final class Cotangent extends TrigonometricFunction {

    public Cotangent(Expression argument) {
        super(argument);
    }

    @Override
    public String functionName() {
        return "cot";
    }

    @Override
    public Cotangent withArgument(Expression newArgument) {
        return new Cotangent(newArgument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCotangent(this);
    }
}
