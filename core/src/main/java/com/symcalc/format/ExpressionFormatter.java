package com.symcalc.format;

import com.symcalc.config.EvaluationConfig;
import com.symcalc.config.FormatConfig;
import com.symcalc.expression.*;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Renders expression trees in canonical mathematical notation.
 *
 * <p>Parenthesization has one rule: an operand that must be wrapped is
 * rendered bare when it is atomic (a literal, variable or constant) and in
 * parentheses otherwise. Sums never wrap their operands; products, fractions,
 * powers and radicals always wrap theirs.
 *
 * <p>Examples:
 * <pre>
 *   2 * (3 + 4)
 *   2 + 3 * 4
 *   (x + 1)/2
 *   2 * (√3)
 *   3√x
 *   log_2(8)
 *   log_{x + 1}(y)
 *   sin(π/2)
 * </pre>
 */
public final class ExpressionFormatter implements ExpressionVisitor<String> {

    private static final ExpressionFormatter INSTANCE = new ExpressionFormatter();

    private ExpressionFormatter() {}

    public static ExpressionFormatter get() {
        return INSTANCE;
    }

    /**
     * Formats an expression tree.
     *
     * @param expression the tree to render
     * @return the canonical string
     * @throws NullPointerException if expression is null
     */
    public String format(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return expression.accept(this);
    }

    /**
     * Renders atomic nodes bare and composites in parentheses.
     */
    private String wrap(Expression expression) {
        String rendered = format(expression);
        return expression.isAtomic() ? rendered : "(" + rendered + ")";
    }

    @Override
    public String visitIntegerLiteral(IntegerLiteral literal) {
        return literal.value().toString();
    }

    @Override
    public String visitDecimalLiteral(DecimalLiteral literal) {
        BigDecimal stripped = literal.value().stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigInteger().toString();
        }
        return stripped
            .setScale(FormatConfig.DECIMAL_DIGITS, EvaluationConfig.ROUNDING_MODE)
            .stripTrailingZeros()
            .toPlainString();
    }

    @Override
    public String visitVariable(VariableReference variable) {
        return variable.name();
    }

    @Override
    public String visitConstantE(ConstantE constant) {
        return FormatConfig.E_SYMBOL;
    }

    @Override
    public String visitConstantPi(ConstantPi constant) {
        return FormatConfig.PI_SYMBOL;
    }

    @Override
    public String visitImaginaryUnit(ImaginaryUnit unit) {
        return FormatConfig.IMAGINARY_SYMBOL;
    }

    @Override
    public String visitFraction(Fraction fraction) {
        return wrap(fraction.numerator()) + "/" + wrap(fraction.denominator());
    }

    @Override
    public String visitLogarithm(Logarithm logarithm) {
        String argument = format(logarithm.argument());
        Expression base = logarithm.base();
        if (logarithm.isNatural()) {
            return "ln(" + argument + ")";
        }
        // Braces mark a base that is not a single literal or variable
        if (base instanceof IntegerLiteral || base instanceof DecimalLiteral ||
            base instanceof VariableReference) {
            return "log_" + format(base) + "(" + argument + ")";
        }
        return "log_{" + format(base) + "}(" + argument + ")";
    }

    @Override
    public String visitSum(Sum sum) {
        return format(sum.left()) + " + " + format(sum.right());
    }

    @Override
    public String visitProduct(Product product) {
        return wrap(product.left()) + " * " + wrap(product.right());
    }

    @Override
    public String visitPower(Power power) {
        return wrap(power.base()) + "^" + wrap(power.exponent());
    }

    @Override
    public String visitRadical(Radical radical) {
        if (radical.isSquareRoot()) {
            return FormatConfig.RADICAL_SIGN + wrap(radical.radicand());
        }
        return format(radical.degree()) + FormatConfig.RADICAL_SIGN + wrap(radical.radicand());
    }

    @Override
    public String visitSine(Sine sine) {
        return function(sine);
    }

    @Override
    public String visitCosine(Cosine cosine) {
        return function(cosine);
    }

    @Override
    public String visitTangent(Tangent tangent) {
        return function(tangent);
    }

    @Override
    public String visitCotangent(Cotangent cotangent) {
        return function(cotangent);
    }

    @Override
    public String visitSecant(Secant secant) {
        return function(secant);
    }

    @Override
    public String visitCosecant(Cosecant cosecant) {
        return function(cosecant);
    }

    private String function(TrigonometricFunction function) {
        return function.functionName() + "(" + format(function.argument()) + ")";
    }
}
