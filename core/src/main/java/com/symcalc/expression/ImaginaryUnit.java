package com.symcalc.expression;

/**
 * Expression representing the imaginary unit i.
 *
 * <p>The unit can be built, simplified and rendered, but there is no complex
 * arithmetic: evaluating any tree that contains it fails.
 */
public final class ImaginaryUnit implements Expression {

    private static final ImaginaryUnit INSTANCE = new ImaginaryUnit();

    private ImaginaryUnit() {}

    public static ImaginaryUnit get() {
        return INSTANCE;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitImaginaryUnit(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ImaginaryUnit;
    }

    @Override
    public int hashCode() {
        return "i".hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
