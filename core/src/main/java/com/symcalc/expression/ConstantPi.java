package com.symcalc.expression;

/**
 * Expression representing the circle constant π.
 */
public final class ConstantPi implements Expression {

    private static final ConstantPi INSTANCE = new ConstantPi();

    private ConstantPi() {}

    public static ConstantPi get() {
        return INSTANCE;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstantPi(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ConstantPi;
    }

    @Override
    public int hashCode() {
        return "pi".hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
