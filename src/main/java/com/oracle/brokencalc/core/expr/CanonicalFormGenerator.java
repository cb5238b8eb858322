package com.oracle.brokencalc.core.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Produces a string that is equal for two equations iff they only differ by
 * reordering operands of {@code +} or {@code *}.
 * <p>
 * Examples:
 * <ul>
 *   <li>{@code 9+1+9} and {@code 9+9+1} both give {@code (1+9+9)}</li>
 *   <li>{@code 5*2+3} gives {@code ((2*5)+3)}</li>
 *   <li>{@code 10-5} gives {@code (10-5)}, {@code 5-10} gives {@code (5-10)}</li>
 *   <li>{@code -(5+2)} gives {@code (-(2+5))}</li>
 * </ul>
 */
public class CanonicalFormGenerator {

    /**
     * Canonical form of the text, or the text with all whitespace removed if it does not parse.
     */
    public String canonicalize(String text) {
        try {
            return canonicalize(ExpressionParser.parse(text));
        } catch (ExpressionSyntaxException e) {
            return stripWhitespace(text);
        }
    }

    public String canonicalize(ExpressionNode node) {
        NodeKind kind = node.getKind();
        if (kind == NodeKind.NUMBER) {
            return node.literalText();
        }
        if (kind == NodeKind.NEGATE) {
            return "(-" + canonicalize(node.getOperand()) + ")";
        }
        if (kind.isCommutative()) {
            List<String> operands = new ArrayList<>();
            collectOperands(node, kind, operands);
            Collections.sort(operands);
            return "(" + String.join(kind.getSymbol(), operands) + ")";
        }
        return "(" + canonicalize(node.getLeft()) + kind.getSymbol() + canonicalize(node.getRight()) + ")";
    }

    // flattens a chain of the same operator, e.g. (1+2)+(3+4) -> [1, 2, 3, 4]
    private void collectOperands(ExpressionNode node, NodeKind chainKind, List<String> out) {
        if (node.getKind() == chainKind) {
            collectOperands(node.getLeft(), chainKind, out);
            collectOperands(node.getRight(), chainKind, out);
        } else {
            out.add(canonicalize(node));
        }
    }

    public static String stripWhitespace(String text) {
        return text == null ? "" : text.replaceAll("\\s+", "");
    }
}
