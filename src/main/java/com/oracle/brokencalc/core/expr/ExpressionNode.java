package com.oracle.brokencalc.core.expr;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A node of a parsed equation. The {@link NodeKind} tag decides which fields
 * are populated:
 * <ul>
 *   <li>{@code NUMBER}: {@code value}</li>
 *   <li>{@code NEGATE}: {@code left} (the operand)</li>
 *   <li>binary kinds: {@code left} and {@code right}</li>
 * </ul>
 * Trees are built only through the static factories and are never shared.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExpressionNode {

    private final NodeKind kind;
    private final BigDecimal value;
    private final ExpressionNode left;
    private final ExpressionNode right;

    /** Operator levels below and including this node; 0 for a number. */
    private final int height;

    public static ExpressionNode number(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        return new ExpressionNode(NodeKind.NUMBER, normalize(value), null, null, 0);
    }

    public static ExpressionNode number(String literal) {
        return number(new BigDecimal(literal));
    }

    public static ExpressionNode negate(ExpressionNode operand) {
        Objects.requireNonNull(operand, "operand");
        return new ExpressionNode(NodeKind.NEGATE, null, operand, null, operand.height + 1);
    }

    public static ExpressionNode binary(NodeKind kind, ExpressionNode left, ExpressionNode right) {
        if (!kind.isBinary()) {
            throw new IllegalArgumentException("Not a binary operator: " + kind);
        }
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return new ExpressionNode(kind, null, left, right, Math.max(left.height, right.height) + 1);
    }

    public ExpressionNode getOperand() {
        return left;
    }

    /**
     * Literal text used in canonical forms, e.g. {@code 2.50} and {@code 2.5} both give "2.5".
     */
    public String literalText() {
        return value.toPlainString();
    }

    // 2, 2.0 and 02 are the same operand
    private static BigDecimal normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return literalText();
            case NEGATE:
                return "(-" + left + ")";
            default:
                return "(" + left + kind.getSymbol() + right + ")";
        }
    }
}
