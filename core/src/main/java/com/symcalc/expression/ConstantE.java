package com.symcalc.expression;

/**
 * Expression representing Euler's number e, the natural logarithm base.
 */
public final class ConstantE implements Expression {

    private static final ConstantE INSTANCE = new ConstantE();

    private ConstantE() {}

    public static ConstantE get() {
        return INSTANCE;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstantE(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ConstantE;
    }

    @Override
    public int hashCode() {
        return "e".hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
