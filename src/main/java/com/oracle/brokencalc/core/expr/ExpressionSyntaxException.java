package com.oracle.brokencalc.core.expr;

import lombok.Getter;

@Getter
public class ExpressionSyntaxException extends ExpressionException {

    /**
     * Zero-based character offset of the offending input, or -1 at end of input.
     */
    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }
}
