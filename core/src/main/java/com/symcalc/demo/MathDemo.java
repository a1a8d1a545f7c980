package com.symcalc.demo;

import com.symcalc.evaluate.EvaluatedValue;
import com.symcalc.expression.Expression;
import com.symcalc.expression.MathBuilder;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line demonstration of building, simplifying and evaluating
 * expressions.
 *
 * <p>Usage:
 * <pre>
 * java -cp symcalc-core.jar com.symcalc.demo.MathDemo
 * </pre>
 *
 * <p>For each sample expression, prints its canonical form, its simplified
 * form and its value.
 */
public class MathDemo {

    private static final String UNDEFINED = "undefined";

    public static void main(String[] args) {
        run(System.out);
    }

    /**
     * Prints all sample expressions.
     *
     * @param out destination stream
     */
    public static void run(PrintStream out) {
        for (Map.Entry<String, Expression> sample : samples().entrySet()) {
            out.println("============================================================");
            out.println(sample.getKey());
            out.println("============================================================");
            out.print(describe(sample.getValue()));
            out.println();
        }
    }

    /**
     * Returns the sample expressions, keyed by title, in display order.
     *
     * @return the samples
     */
    public static Map<String, Expression> samples() {
        Map<String, Expression> samples = new LinkedHashMap<>();

        // (3 + 5) * (7 - 2)
        samples.put("Arithmetic", MathBuilder.math(m ->
            m.expr(m.times(m.plus(m.num(3), m.num(5)), m.minus(m.num(7), m.num(2))))));

        // 1/2 + 3/4
        samples.put("Fraction addition", MathBuilder.math(m ->
            m.expr(m.plus(m.frac(m.num(1), m.num(2)), m.frac(m.num(3), m.num(4))))));

        // 1/2 + 2/10
        samples.put("Fraction reduction", MathBuilder.math(m ->
            m.expr(m.plus(m.div(m.num(1), m.num(2)), m.div(m.num(2), m.num(10))))));

        return samples;
    }

    /**
     * Renders the expression, its simplified form and its value, one per line.
     *
     * @param expression the expression to describe
     * @return the three-line description
     */
    public static String describe(Expression expression) {
        String value = expression.evaluate()
            .map(EvaluatedValue::toString)
            .orElse(UNDEFINED);
        return "Expression: " + expression.format() + "\n" +
               "Simplified: " + expression.simplify().format() + "\n" +
               "Value:      " + value + "\n";
    }
}
