package com.oracle.brokencalc.core.expr;

/**
 * Evaluation failed for a reason other than division by zero.
 */
public class ExpressionEvaluationException extends ExpressionException {

    public ExpressionEvaluationException(String message) {
        super(message);
    }
}
