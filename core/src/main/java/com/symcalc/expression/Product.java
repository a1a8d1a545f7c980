package com.symcalc.expression;

import java.util.Objects;

/**
 * Expression representing the multiplication {@code left * right}.
 */
public final class Product implements Expression {

    private final Expression left;
    private final Expression right;

    /**
     * Creates a product.
     *
     * @param left the left operand
     * @param right the right operand
     */
    public Product(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitProduct(this);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Product)) return false;
        Product that = (Product) obj;
        return left.equals(that.left) &&
               right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("*", left, right);
    }
}
