package com.symcalc.expression;

import com.symcalc.exception.ExpressionDefinitionException;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Scoped builder that collects exactly one expression.
 *
 * <p>A fresh builder is handed to a callback, which uses the convenience
 * methods to build a tree and stores it with {@link #expr(Expression)}. The
 * stored expression is returned once the callback completes.
 *
 * <p>Example usage:
 * <pre>
 *   Expression half = MathBuilder.math(m -&gt;
 *       m.expr(m.frac(m.num(1), m.num(2))));
 * </pre>
 */
public final class MathBuilder {

    private Expression expr;

    private MathBuilder() {}

    /**
     * Runs the definition callback and returns the expression it stored.
     *
     * @param definition callback that builds and stores an expression
     * @return the stored expression
     * @throws ExpressionDefinitionException if the callback never stored one
     */
    public static Expression math(Consumer<MathBuilder> definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        MathBuilder builder = new MathBuilder();
        definition.accept(builder);
        if (builder.expr == null) {
            throw new ExpressionDefinitionException("no expression defined");
        }
        return builder.expr;
    }

    /**
     * Stores the result expression, replacing any previous one.
     *
     * @param expression the result
     */
    public void expr(Expression expression) {
        this.expr = Objects.requireNonNull(expression, "expression must not be null");
    }

    public Expression num(long value) {
        return Expressions.num(value);
    }

    public Expression dec(BigDecimal value) {
        return Expressions.dec(value);
    }

    public Expression variable(String name) {
        return Expressions.variable(name);
    }

    public Expression frac(Expression numerator, Expression denominator) {
        return Expressions.fraction(numerator, denominator);
    }

    public Expression ln(Expression argument) {
        return Expressions.ln(argument);
    }

    public Expression log(Expression base, Expression argument) {
        return Expressions.log(base, argument);
    }

    public Expression sin(Expression argument) {
        return Expressions.sin(argument);
    }

    public Expression cos(Expression argument) {
        return Expressions.cos(argument);
    }

    public Expression tan(Expression argument) {
        return Expressions.tan(argument);
    }

    public Expression cot(Expression argument) {
        return Expressions.cot(argument);
    }

    public Expression sec(Expression argument) {
        return Expressions.sec(argument);
    }

    public Expression csc(Expression argument) {
        return Expressions.csc(argument);
    }

    public Expression root(Expression radicand) {
        return Expressions.sqrt(radicand);
    }

    public Expression root(Expression radicand, Expression degree) {
        return Expressions.root(radicand, degree);
    }

    public Expression pow(Expression base, Expression exponent) {
        return Expressions.pow(base, exponent);
    }

    public Expression plus(Expression left, Expression right) {
        return Expressions.add(left, right);
    }

    public Expression minus(Expression left, Expression right) {
        return Expressions.subtract(left, right);
    }

    public Expression times(Expression left, Expression right) {
        return Expressions.multiply(left, right);
    }

    public Expression div(Expression left, Expression right) {
        return Expressions.divide(left, right);
    }

    public Expression negate(Expression operand) {
        return Expressions.negate(operand);
    }
}
