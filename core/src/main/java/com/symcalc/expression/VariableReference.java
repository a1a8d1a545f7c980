package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing a named variable.
 *
 * <p>A variable is unbound until evaluation, where its value is looked up by
 * name in the binding context. Evaluating an unbound variable fails.
 */
public final class VariableReference implements Expression {

    private final String name;

    /**
     * Creates a variable reference.
     *
     * @param name the variable name
     * @throws IllegalArgumentException if the name is blank
     */
    public VariableReference(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("variable name must not be blank");
        }
    }

    /**
     * Returns the variable name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VariableReference)) return false;
        VariableReference that = (VariableReference) obj;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
