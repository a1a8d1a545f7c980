package com.symcalc.simplify;

import com.symcalc.expression.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

import static com.symcalc.expression.ExpressionUtils.asFraction;

/**
 * Rewrites an expression tree into a normal form using exact arithmetic.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Sum: integer + integer folds; rational + rational folds to
 *       {@code (a*d + c*b) / (b*d)}, then reduces</li>
 *   <li>Product: integer * integer folds; rational * rational folds to
 *       {@code (a*c) / (b*d)}; an integer folds into a fraction's integer
 *       numerator</li>
 *   <li>Fraction: integer / integer reduces by the gcd, the sign moves to the
 *       numerator, and a denominator of 1 collapses to an integer</li>
 *   <li>Radical: the largest perfect {@code d}-th power is pulled out of an
 *       integer radicand, e.g. {@code √12 -> 2 * √3}</li>
 * </ul>
 *
 * <p>Every other node is rebuilt with simplified children. Simplification is
 * bottom-up and total: it never fails and never modifies its input. A literal
 * zero denominator is left in place for evaluation to reject.
 *
 * <p>Example usage:
 * <pre>
 *   Expression reduced = Simplifier.get().simplify(fraction(num(12), num(18)));
 *   reduced.format();   // "2/3"
 * </pre>
 */
public final class Simplifier implements ExpressionVisitor<Expression> {

    private static final Logger logger = LoggerFactory.getLogger(Simplifier.class);

    private static final Simplifier INSTANCE = new Simplifier();

    private Simplifier() {}

    public static Simplifier get() {
        return INSTANCE;
    }

    /**
     * Simplifies an expression tree.
     *
     * @param expression the tree to simplify
     * @return the simplified tree
     * @throws NullPointerException if expression is null
     */
    public Expression simplify(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return expression.accept(this);
    }

    // ==================== Leaves ====================

    @Override
    public Expression visitIntegerLiteral(IntegerLiteral literal) {
        return literal;
    }

    @Override
    public Expression visitDecimalLiteral(DecimalLiteral literal) {
        return literal;
    }

    @Override
    public Expression visitVariable(VariableReference variable) {
        return variable;
    }

    @Override
    public Expression visitConstantE(ConstantE constant) {
        return constant;
    }

    @Override
    public Expression visitConstantPi(ConstantPi constant) {
        return constant;
    }

    @Override
    public Expression visitImaginaryUnit(ImaginaryUnit unit) {
        return unit;
    }

    // ==================== Rational arithmetic ====================

    @Override
    public Expression visitFraction(Fraction fraction) {
        return reduce(simplify(fraction.numerator()), simplify(fraction.denominator()));
    }

    @Override
    public Expression visitSum(Sum sum) {
        Expression left = simplify(sum.left());
        Expression right = simplify(sum.right());

        if (left instanceof IntegerLiteral a && right instanceof IntegerLiteral b) {
            return IntegerLiteral.of(a.value().add(b.value()));
        }

        Fraction leftFraction = asFraction(left);
        Fraction rightFraction = asFraction(right);
        if (leftFraction != null && rightFraction != null &&
            leftFraction.isRational() && rightFraction.isRational()) {
            BigInteger a = numeratorOf(leftFraction);
            BigInteger b = denominatorOf(leftFraction);
            BigInteger c = numeratorOf(rightFraction);
            BigInteger d = denominatorOf(rightFraction);
            return reduce(
                IntegerLiteral.of(a.multiply(d).add(c.multiply(b))),
                IntegerLiteral.of(b.multiply(d)));
        }

        return new Sum(left, right);
    }

    @Override
    public Expression visitProduct(Product product) {
        Expression left = simplify(product.left());
        Expression right = simplify(product.right());

        if (left instanceof IntegerLiteral a && right instanceof IntegerLiteral b) {
            return IntegerLiteral.of(a.value().multiply(b.value()));
        }
        if (left instanceof Fraction l && right instanceof Fraction r) {
            if (l.isRational() && r.isRational()) {
                return reduce(
                    IntegerLiteral.of(numeratorOf(l).multiply(numeratorOf(r))),
                    IntegerLiteral.of(denominatorOf(l).multiply(denominatorOf(r))));
            }
        } else if (left instanceof Fraction l && right instanceof IntegerLiteral r) {
            if (l.numerator() instanceof IntegerLiteral n) {
                return reduce(IntegerLiteral.of(n.value().multiply(r.value())), l.denominator());
            }
        } else if (left instanceof IntegerLiteral l && right instanceof Fraction r) {
            if (r.numerator() instanceof IntegerLiteral n) {
                return reduce(IntegerLiteral.of(n.value().multiply(l.value())), r.denominator());
            }
        }

        return new Product(left, right);
    }

    /**
     * Reduces an already-simplified numerator and denominator.
     */
    private Expression reduce(Expression numerator, Expression denominator) {
        if (!(numerator instanceof IntegerLiteral n) || !(denominator instanceof IntegerLiteral d)) {
            return new Fraction(numerator, denominator);
        }
        BigInteger num = n.value();
        BigInteger den = d.value();
        if (den.signum() == 0) {
            return new Fraction(numerator, denominator);
        }

        // gcd is computed on absolute values and is never zero here
        BigInteger gcd = num.gcd(den);
        if (den.signum() < 0) {
            num = num.negate();
            den = den.negate();
        }
        num = num.divide(gcd);
        den = den.divide(gcd);

        if (den.equals(BigInteger.ONE)) {
            return IntegerLiteral.of(num);
        }
        return new Fraction(IntegerLiteral.of(num), IntegerLiteral.of(den));
    }

    private static BigInteger numeratorOf(Fraction fraction) {
        return ((IntegerLiteral) fraction.numerator()).value();
    }

    private static BigInteger denominatorOf(Fraction fraction) {
        return ((IntegerLiteral) fraction.denominator()).value();
    }

    // ==================== Radicals ====================

    @Override
    public Expression visitRadical(Radical radical) {
        Expression radicand = simplify(radical.radicand());
        Expression degree = simplify(radical.degree());
        if (radicand instanceof IntegerLiteral r && degree instanceof IntegerLiteral d) {
            return extractPerfectPowers(r, d);
        }
        return new Radical(radicand, degree);
    }

    /**
     * Pulls the largest {@code factor} with {@code factor^d | radicand} out of
     * the root. Only positive radicands and degrees are factored; anything
     * else is returned as a radical.
     */
    private Expression extractPerfectPowers(IntegerLiteral radicand, IntegerLiteral degree) {
        BigInteger value = radicand.value();
        BigInteger degreeValue = degree.value();

        if (value.signum() <= 0 || degreeValue.signum() <= 0 ||
            degreeValue.bitLength() >= Integer.SIZE) {
            logger.debug("Radical {}√{} left unfactored: radicand and degree must be positive",
                degreeValue, value);
            return new Radical(radicand, degree);
        }
        int d = degreeValue.intValue();
        if (d == 1) {
            return radicand;
        }

        BigInteger factor = BigInteger.ONE;
        BigInteger remaining = value;
        // 2^d > radicand whenever d >= bitLength, so no candidate can divide
        boolean hasCandidates = d < value.bitLength();
        for (BigInteger i = BigInteger.TWO; hasCandidates; i = i.add(BigInteger.ONE)) {
            BigInteger power = i.pow(d);
            if (power.compareTo(remaining) > 0) {
                break;
            }
            while (remaining.mod(power).signum() == 0) {
                factor = factor.multiply(i);
                remaining = remaining.divide(power);
            }
        }

        if (remaining.equals(BigInteger.ONE)) {
            return IntegerLiteral.of(factor);
        }
        if (factor.compareTo(BigInteger.ONE) > 0) {
            return new Product(IntegerLiteral.of(factor),
                new Radical(IntegerLiteral.of(remaining), degree));
        }
        return new Radical(radicand, degree);
    }

    // ==================== Structural recursion ====================

    @Override
    public Expression visitLogarithm(Logarithm logarithm) {
        return new Logarithm(simplify(logarithm.argument()), simplify(logarithm.base()));
    }

    @Override
    public Expression visitPower(Power power) {
        return new Power(simplify(power.base()), simplify(power.exponent()));
    }

    @Override
    public Expression visitSine(Sine sine) {
        return sine.withArgument(simplify(sine.argument()));
    }

    @Override
    public Expression visitCosine(Cosine cosine) {
        return cosine.withArgument(simplify(cosine.argument()));
    }

    @Override
    public Expression visitTangent(Tangent tangent) {
        return tangent.withArgument(simplify(tangent.argument()));
    }

    @Override
    public Expression visitCotangent(Cotangent cotangent) {
        return cotangent.withArgument(simplify(cotangent.argument()));
    }

    @Override
    public Expression visitSecant(Secant secant) {
        return secant.withArgument(simplify(secant.argument()));
    }

    @Override
    public Expression visitCosecant(Cosecant cosecant) {
        return cosecant.withArgument(simplify(cosecant.argument()));
    }
}
