package com.symcalc.exception;

/**
 * Exception thrown when a {@link com.symcalc.expression.MathBuilder} callback
 * completes without storing an expression.
 */
public class ExpressionDefinitionException extends RuntimeException {

    public ExpressionDefinitionException(String message) {
        super(message);
    }
}
