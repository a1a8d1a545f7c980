package com.symcalc.expression;

import com.symcalc.evaluate.EvaluatedValue;
import com.symcalc.evaluate.Evaluator;
import com.symcalc.format.ExpressionFormatter;
import com.symcalc.simplify.Simplifier;

import java.util.Map;
import java.util.Optional;

/**
 * Base interface for all nodes of a symbolic expression tree.
 *
 * <p>Expressions represent mathematical formulas, such as:
 * <ul>
 *   <li>Literals (integers and decimals)</li>
 *   <li>Variable references, bound at evaluation time</li>
 *   <li>The constants e, π and the imaginary unit</li>
 *   <li>Arithmetic (sum, product, fraction, power, radical)</li>
 *   <li>Logarithms and trigonometric functions</li>
 * </ul>
 *
 * <p>Three operations are defined over every tree:
 * <ul>
 *   <li>{@link #simplify()} - exact rational normalization and radical factorization</li>
 *   <li>{@link #evaluate(Map)} - numeric reduction under a binding context</li>
 *   <li>{@link #format()} - canonical text rendering</li>
 * </ul>
 *
 * <p>The hierarchy is closed. Every engine is an {@link ExpressionVisitor}, so a
 * new node kind cannot be added without every engine handling it. All
 * implementations are immutable and may be shared freely across threads.
 */
public sealed interface Expression
    permits IntegerLiteral, DecimalLiteral, VariableReference,
            ConstantE, ConstantPi, ImaginaryUnit,
            Fraction, Logarithm, Sum, Product, Power, Radical,
            TrigonometricFunction {

    /**
     * Dispatches to the visit method matching this node's kind.
     *
     * @param visitor the visitor
     * @param <R> the visitor's result type
     * @return the visitor's result for this node
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Returns whether this node is a leaf: a literal, a variable or a nullary
     * constant. Atomic nodes are never parenthesized when rendered.
     *
     * @return true for leaf nodes, false for composites
     */
    default boolean isAtomic() {
        return false;
    }

    /**
     * Returns the simplified form of this expression.
     *
     * @return a new, normalized tree (this node is never modified)
     */
    default Expression simplify() {
        return Simplifier.get().simplify(this);
    }

    /**
     * Evaluates this expression with the given variable bindings.
     *
     * @param bindings variable name to numeric value
     * @return the rounded value, or empty if evaluation failed
     */
    default Optional<EvaluatedValue> evaluate(Map<String, ? extends Number> bindings) {
        return new Evaluator().evaluate(this, bindings);
    }

    /**
     * Evaluates this expression without any variable bindings.
     *
     * @return the rounded value, or empty if evaluation failed
     */
    default Optional<EvaluatedValue> evaluate() {
        return evaluate(Map.of());
    }

    /**
     * Renders this expression in canonical notation.
     *
     * @return the formatted string
     */
    default String format() {
        return ExpressionFormatter.get().format(this);
    }
}
