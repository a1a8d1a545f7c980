package com.symcalc.expression;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Utility methods for classifying and inspecting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the integer literal as a fraction over one, the fraction itself,
     * or null for anything else.
     *
     * @param expr the expression to coerce
     * @return a fraction view of the expression, or null
     */
    public static Fraction asFraction(Expression expr) {
        if (expr instanceof Fraction fraction) {
            return fraction;
        }
        if (expr instanceof IntegerLiteral literal) {
            return new Fraction(literal, IntegerLiteral.ONE);
        }
        return null;
    }

    /**
     * Collects the names of all variables referenced in the tree, in
     * first-occurrence order (left to right).
     *
     * @param expr the expression to scan
     * @return the variable names
     */
    public static Set<String> variableNames(Expression expr) {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(expr, names);
        return names;
    }

    /**
     * Returns true if the tree contains no variables, so it can be evaluated
     * without bindings.
     *
     * @param expr the expression to check
     * @return true if closed
     */
    public static boolean isClosed(Expression expr) {
        return variableNames(expr).isEmpty();
    }

    private static void collectVariables(Expression expr, Set<String> names) {
        if (expr instanceof VariableReference variable) {
            names.add(variable.name());
        } else if (expr instanceof Fraction fraction) {
            collectVariables(fraction.numerator(), names);
            collectVariables(fraction.denominator(), names);
        } else if (expr instanceof Logarithm log) {
            collectVariables(log.argument(), names);
            collectVariables(log.base(), names);
        } else if (expr instanceof Sum sum) {
            collectVariables(sum.left(), names);
            collectVariables(sum.right(), names);
        } else if (expr instanceof Product product) {
            collectVariables(product.left(), names);
            collectVariables(product.right(), names);
        } else if (expr instanceof Power power) {
            collectVariables(power.base(), names);
            collectVariables(power.exponent(), names);
        } else if (expr instanceof Radical radical) {
            collectVariables(radical.radicand(), names);
            collectVariables(radical.degree(), names);
        } else if (expr instanceof TrigonometricFunction trig) {
            collectVariables(trig.argument(), names);
        }
        // Literals and constants reference no variables
    }
}
