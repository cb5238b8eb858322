package com.oracle.brokencalc.core.expr;

public class DivisionByZeroException extends ExpressionException {

    public DivisionByZeroException() {
        super("Division by zero");
    }
}
