package com.oracle.brokencalc.core.expr;

/**
 * Base type for everything that can go wrong turning equation text into a number.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
