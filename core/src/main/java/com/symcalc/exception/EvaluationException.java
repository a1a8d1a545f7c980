package com.symcalc.exception;

import com.symcalc.expression.Expression;

import java.util.Objects;

/**
 * Exception thrown when an expression cannot be reduced to a number.
 *
 * <p>Evaluation is the only operation that can fail; simplification and
 * formatting are total. The public {@code evaluate} contract converts this
 * exception into an empty result, while
 * {@link com.symcalc.evaluate.Evaluator#evaluateOrThrow} lets it through for
 * callers that need to know why no value was produced.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       EvaluatedValue value = evaluator.evaluateOrThrow(expr, bindings);
 *   } catch (EvaluationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed node: " + e.getFailedExpression());
 *   }
 * </pre>
 *
 * @see com.symcalc.evaluate.Evaluator
 */
public class EvaluationException extends RuntimeException {

    /**
     * Failure kinds.
     */
    public enum Failure {
        MISSING_VARIABLE("missing variable"),
        DIVISION_BY_ZERO("division by zero"),
        DOMAIN_ERROR("domain error"),
        UNSUPPORTED_OPERATION("unsupported operation");

        private final String description;

        Failure(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Failure failure;
    private final Expression failedExpression;

    /**
     * Creates an evaluation exception.
     *
     * @param failure the failure kind
     * @param message the error message
     * @param expression the node whose evaluation failed
     */
    public EvaluationException(Failure failure, String message, Expression expression) {
        super(failure.description() + ": " + message);
        this.failure = Objects.requireNonNull(failure, "failure must not be null");
        this.failedExpression = expression;
    }

    /**
     * Returns the failure kind.
     *
     * @return the failure kind
     */
    public Failure getFailure() {
        return failure;
    }

    /**
     * Returns the node whose evaluation failed.
     *
     * @return the failed node, or null if not available
     */
    public Expression getFailedExpression() {
        return failedExpression;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String node = failedExpression != null ? failedExpression.format() : "expression";
        switch (failure) {
            case MISSING_VARIABLE:
                return "No value was bound for '" + node + "'. " +
                       "Add it to the bindings passed to evaluate().";
            case DIVISION_BY_ZERO:
                return "The denominator of " + node + " evaluates to zero.";
            case DOMAIN_ERROR:
                return node + " is undefined at this argument " +
                       "(the underlying function is zero).";
            case UNSUPPORTED_OPERATION:
                return "Complex numbers are not supported; " + node + " cannot be evaluated.";
            default:
                return "Evaluation failed: " + getMessage();
        }
    }
}
