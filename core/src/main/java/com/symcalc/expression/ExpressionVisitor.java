package com.symcalc.expression;

/**
 * Visitor over the closed {@link Expression} hierarchy.
 *
 * <p>One method per node kind. Implementations are the simplifier, the
 * evaluator and the formatter.
 *
 * @param <R> the result type of a visit
 */
public interface ExpressionVisitor<R> {

    R visitIntegerLiteral(IntegerLiteral literal);

    R visitDecimalLiteral(DecimalLiteral literal);

    R visitVariable(VariableReference variable);

    R visitConstantE(ConstantE constant);

    R visitConstantPi(ConstantPi constant);

    R visitImaginaryUnit(ImaginaryUnit unit);

    R visitFraction(Fraction fraction);

    R visitLogarithm(Logarithm logarithm);

    R visitSum(Sum sum);

    R visitProduct(Product product);

    R visitPower(Power power);

    R visitRadical(Radical radical);

    R visitSine(Sine sine);

    R visitCosine(Cosine cosine);

    R visitTangent(Tangent tangent);

    R visitCotangent(Cotangent cotangent);

    R visitSecant(Secant secant);

    R visitCosecant(Cosecant cosecant);
}
