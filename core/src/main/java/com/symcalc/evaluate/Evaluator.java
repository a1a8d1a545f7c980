package com.symcalc.evaluate;

import com.symcalc.config.EvaluationConfig;
import com.symcalc.exception.EvaluationException;
import com.symcalc.exception.EvaluationException.Failure;
import com.symcalc.expression.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reduces an expression tree and a set of variable bindings to a number.
 *
 * <p>Evaluation runs in double arithmetic and rounds once, at the end, to
 * the configured scale (10 fractional digits, half-up, by default).
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link Failure#MISSING_VARIABLE} - a variable has no binding</li>
 *   <li>{@link Failure#DIVISION_BY_ZERO} - a fraction's denominator is exactly zero</li>
 *   <li>{@link Failure#DOMAIN_ERROR} - the tan/cos/sin under cot/sec/csc is exactly zero</li>
 *   <li>{@link Failure#UNSUPPORTED_OPERATION} - the tree contains the imaginary unit</li>
 * </ul>
 *
 * <p>{@link #evaluate} turns any failure into an empty result; {@link #evaluateOrThrow}
 * reports it. Logarithm, power and root domain problems are not failures: they
 * produce NaN or an infinity, which is returned unchanged.
 *
 * <p>An evaluator holds no mutable state and may be shared across threads.
 */
public final class Evaluator {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final int scale;

    /**
     * Creates an evaluator using the scale from
     * {@link EvaluationConfig#SCALE_PROPERTY}, or the default of 10.
     */
    public Evaluator() {
        this(EvaluationConfig.configuredScale());
    }

    /**
     * Creates an evaluator with an explicit result scale.
     *
     * @param scale fractional digits in results, clamped to the allowed range
     */
    public Evaluator(int scale) {
        this.scale = EvaluationConfig.normalizeScale(scale);
    }

    public int scale() {
        return scale;
    }

    /**
     * Evaluates an expression.
     *
     * @param expression the tree to evaluate
     * @param bindings variable name to value
     * @return the rounded value, or empty if evaluation failed
     * @throws NullPointerException if expression or bindings is null
     */
    public Optional<EvaluatedValue> evaluate(Expression expression, Map<String, ? extends Number> bindings) {
        try {
            return Optional.of(evaluateOrThrow(expression, bindings));
        } catch (EvaluationException e) {
            logger.debug("Evaluation of {} produced no value ({})", expression, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Evaluates an expression, reporting why no value could be produced.
     *
     * @param expression the tree to evaluate
     * @param bindings variable name to value
     * @return the rounded value
     * @throws EvaluationException if evaluation failed
     * @throws NullPointerException if expression or bindings is null
     */
    public EvaluatedValue evaluateOrThrow(Expression expression, Map<String, ? extends Number> bindings) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");

        double raw = expression.accept(new EvaluationVisitor(bindings));
        return EvaluatedValue.of(raw, scale);
    }

    /**
     * Single-use visitor carrying the bindings of one evaluation.
     */
    private static final class EvaluationVisitor implements ExpressionVisitor<Double> {

        private final Map<String, ? extends Number> bindings;

        EvaluationVisitor(Map<String, ? extends Number> bindings) {
            this.bindings = bindings;
        }

        private double eval(Expression expression) {
            return expression.accept(this);
        }

        @Override
        public Double visitIntegerLiteral(IntegerLiteral literal) {
            return literal.value().doubleValue();
        }

        @Override
        public Double visitDecimalLiteral(DecimalLiteral literal) {
            return literal.value().doubleValue();
        }

        @Override
        public Double visitVariable(VariableReference variable) {
            Number value = bindings.get(variable.name());
            if (value == null) {
                throw new EvaluationException(Failure.MISSING_VARIABLE,
                    "no value bound for variable '" + variable.name() + "'", variable);
            }
            return value.doubleValue();
        }

        @Override
        public Double visitConstantE(ConstantE constant) {
            return Math.E;
        }

        @Override
        public Double visitConstantPi(ConstantPi constant) {
            return Math.PI;
        }

        @Override
        public Double visitImaginaryUnit(ImaginaryUnit unit) {
            throw new EvaluationException(Failure.UNSUPPORTED_OPERATION,
                "complex arithmetic is not supported", unit);
        }

        @Override
        public Double visitFraction(Fraction fraction) {
            double numerator = eval(fraction.numerator());
            double denominator = eval(fraction.denominator());
            if (denominator == 0.0) {
                throw new EvaluationException(Failure.DIVISION_BY_ZERO,
                    "denominator of " + fraction + " is zero", fraction);
            }
            return numerator / denominator;
        }

        @Override
        public Double visitSum(Sum sum) {
            return eval(sum.left()) + eval(sum.right());
        }

        @Override
        public Double visitProduct(Product product) {
            return eval(product.left()) * eval(product.right());
        }

        @Override
        public Double visitPower(Power power) {
            double base = eval(power.base());
            double exponent = eval(power.exponent());
            if (isExactInteger(exponent) &&
                Math.abs(exponent) <= EvaluationConfig.MAX_REPEATED_MULTIPLICATIONS) {
                int n = (int) Math.abs(exponent);
                double result = 1.0;
                for (int i = 0; i < n; i++) {
                    result *= base;
                }
                return exponent < 0 ? 1.0 / result : result;
            }
            return Math.pow(base, exponent);
        }

        @Override
        public Double visitRadical(Radical radical) {
            double radicand = eval(radical.radicand());
            double degree = eval(radical.degree());
            return Math.pow(radicand, 1.0 / degree);
        }

        @Override
        public Double visitLogarithm(Logarithm logarithm) {
            double argument = eval(logarithm.argument());
            double base = eval(logarithm.base());
            return Math.log(argument) / Math.log(base);
        }

        @Override
        public Double visitSine(Sine sine) {
            return Math.sin(eval(sine.argument()));
        }

        @Override
        public Double visitCosine(Cosine cosine) {
            return Math.cos(eval(cosine.argument()));
        }

        @Override
        public Double visitTangent(Tangent tangent) {
            return Math.tan(eval(tangent.argument()));
        }

        @Override
        public Double visitCotangent(Cotangent cotangent) {
            return reciprocal(Math.tan(eval(cotangent.argument())), cotangent);
        }

        @Override
        public Double visitSecant(Secant secant) {
            return reciprocal(Math.cos(eval(secant.argument())), secant);
        }

        @Override
        public Double visitCosecant(Cosecant cosecant) {
            return reciprocal(Math.sin(eval(cosecant.argument())), cosecant);
        }

        private static double reciprocal(double value, TrigonometricFunction function) {
            if (value == 0.0) {
                throw new EvaluationException(Failure.DOMAIN_ERROR,
                    function.functionName() + " is undefined where its reciprocal is zero", function);
            }
            return 1.0 / value;
        }

        private static boolean isExactInteger(double value) {
            return Double.isFinite(value) && value == Math.rint(value);
        }
    }
}
