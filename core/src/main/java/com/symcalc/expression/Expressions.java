package com.symcalc.expression;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Static factories for building expression trees.
 *
 * <p>These are construction conveniences only; no method here simplifies or
 * evaluates anything. Subtraction and negation are expressed with a factor of
 * {@code -1}, so {@code subtract(a, b)} builds {@code a + (-1 * b)}.
 *
 * <p>Example usage:
 * <pre>
 *   import static com.symcalc.expression.Expressions.*;
 *
 *   Expression expr = multiply(add(num(3), num(5)), subtract(num(7), num(2)));
 *   expr.format();      // "(3 + 5) * (7 + -1 * 2)"
 * </pre>
 */
public final class Expressions {

    private Expressions() {}

    // ==================== Leaves ====================

    public static IntegerLiteral num(long value) {
        return IntegerLiteral.of(value);
    }

    public static IntegerLiteral num(BigInteger value) {
        return IntegerLiteral.of(value);
    }

    public static DecimalLiteral dec(BigDecimal value) {
        return DecimalLiteral.of(value);
    }

    public static DecimalLiteral dec(String value) {
        return DecimalLiteral.of(value);
    }

    public static VariableReference variable(String name) {
        return new VariableReference(name);
    }

    public static ConstantE e() {
        return ConstantE.get();
    }

    public static ConstantPi pi() {
        return ConstantPi.get();
    }

    public static ImaginaryUnit i() {
        return ImaginaryUnit.get();
    }

    // ==================== Arithmetic ====================

    public static Sum add(Expression left, Expression right) {
        return new Sum(left, right);
    }

    /**
     * Builds {@code left + (-1 * right)}.
     */
    public static Sum subtract(Expression left, Expression right) {
        return new Sum(left, negate(right));
    }

    public static Product multiply(Expression left, Expression right) {
        return new Product(left, right);
    }

    /**
     * Builds {@code numerator / denominator} as a {@link Fraction}.
     */
    public static Fraction divide(Expression numerator, Expression denominator) {
        return new Fraction(numerator, denominator);
    }

    public static Fraction fraction(Expression numerator, Expression denominator) {
        return new Fraction(numerator, denominator);
    }

    /**
     * Builds {@code -1 * operand}.
     */
    public static Product negate(Expression operand) {
        return new Product(IntegerLiteral.MINUS_ONE, operand);
    }

    public static Power pow(Expression base, Expression exponent) {
        return new Power(base, exponent);
    }

    // ==================== Functions ====================

    public static Radical sqrt(Expression radicand) {
        return new Radical(radicand);
    }

    public static Radical root(Expression radicand, Expression degree) {
        return new Radical(radicand, degree);
    }

    public static Logarithm ln(Expression argument) {
        return new Logarithm(argument);
    }

    /**
     * Builds {@code log_base(argument)}. Note the base comes first.
     */
    public static Logarithm log(Expression base, Expression argument) {
        return new Logarithm(argument, base);
    }

    public static Sine sin(Expression argument) {
        return new Sine(argument);
    }

    public static Cosine cos(Expression argument) {
        return new Cosine(argument);
    }

    public static Tangent tan(Expression argument) {
        return new Tangent(argument);
    }

    public static Cotangent cot(Expression argument) {
        return new Cotangent(argument);
    }

    public static Secant sec(Expression argument) {
        return new Secant(argument);
    }

    public static Cosecant csc(Expression argument) {
        return new Cosecant(argument);
    }
}
