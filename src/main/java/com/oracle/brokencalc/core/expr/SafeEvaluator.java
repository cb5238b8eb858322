package com.oracle.brokencalc.core.expr;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Computes the value of an expression tree. Only addition, subtraction,
 * multiplication, true division and negation are dispatched; any other tag
 * reaching {@link #evaluateNode} is a programming error.
 * <p>
 * Arithmetic is exact on the decimal literals; division rounds to 34
 * significant digits. The result is converted to {@code double} at the end.
 */
public class SafeEvaluator {

    public double evaluate(ExpressionNode root) {
        double result = evaluateExact(root).doubleValue();
        if (!Double.isFinite(result)) {
            throw new ExpressionEvaluationException("Result is not a finite number");
        }
        return result;
    }

    public double evaluate(String text) {
        return evaluate(ExpressionParser.parse(text));
    }

    public BigDecimal evaluateExact(ExpressionNode root) {
        return evaluateNode(root);
    }

    private BigDecimal evaluateNode(ExpressionNode node) {
        switch (node.getKind()) {
            case NUMBER:
                return node.getValue();
            case NEGATE:
                return evaluateNode(node.getOperand()).negate();
            case ADD:
                return evaluateNode(node.getLeft()).add(evaluateNode(node.getRight()));
            case SUBTRACT:
                return evaluateNode(node.getLeft()).subtract(evaluateNode(node.getRight()));
            case MULTIPLY:
                return evaluateNode(node.getLeft()).multiply(evaluateNode(node.getRight()));
            case DIVIDE:
                BigDecimal dividend = evaluateNode(node.getLeft());
                BigDecimal divisor = evaluateNode(node.getRight());
                if (divisor.signum() == 0) {
                    throw new DivisionByZeroException();
                }
                return dividend.divide(divisor, MathContext.DECIMAL128);
            default:
                throw new IllegalStateException("Unsupported node kind: " + node.getKind());
        }
    }
}
