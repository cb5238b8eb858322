package com.oracle.brokencalc.core.expr;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SafeEvaluatorTest {

    private final SafeEvaluator evaluator = new SafeEvaluator();

    @Test
    void respectsPrecedenceAndParentheses() {
        assertEquals(14.0, evaluator.evaluate("2+3*4"));
        assertEquals(20.0, evaluator.evaluate("(2+3)*4"));
        assertEquals(5.0, evaluator.evaluate("8-2-1"));
        assertEquals(7.0, evaluator.evaluate("8-(2-1)"));
    }

    @Test
    void divisionIsNotTruncated() {
        assertEquals(3.5, evaluator.evaluate("7/2"));
        assertEquals(1.0 / 3, evaluator.evaluate("1/3"), 1e-12);
        assertEquals(0.0, evaluator.evaluate("0/5"));
    }

    @Test
    void negation() {
        assertEquals(7.0, evaluator.evaluate("-3+10"));
        assertEquals(5.0, evaluator.evaluate("2--3"));
        assertEquals(-7.0, evaluator.evaluate("-(5+2)"));
        assertEquals(4.0, evaluator.evaluate("--4"));
    }

    @Test
    void decimalOperands() {
        assertEquals(3.0, evaluator.evaluate("2.5+.5"));
        assertEquals(1.25, evaluator.evaluate("0.5*2.5"));
    }

    @Test
    void divisionByZeroFails() {
        assertThrows(DivisionByZeroException.class, () -> evaluator.evaluate("5/0"));
        assertThrows(DivisionByZeroException.class, () -> evaluator.evaluate("5/(3-3)"));
        assertThrows(DivisionByZeroException.class, () -> evaluator.evaluate("1/0.0"));
    }

    @Test
    void nonFiniteResultFails() {
        String huge = "9".repeat(400);
        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.evaluate(huge + "*2"));
        assertEquals("Result is not a finite number", e.getMessage());
    }

    @Test
    void integerArithmeticIsExact() {
        assertEquals(1.0, evaluator.evaluate("9999999999999999+1-9999999999999999"));
        assertEquals(new BigDecimal("10000000000000000"),
                evaluator.evaluateExact(ExpressionParser.parse("9999999999999999+1")));
        assertEquals(0.0, evaluator.evaluate("123456789012345678*10-1234567890123456780"));
    }
}
