package com.oracle.brokencalc.core.expr;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of node tags in an expression tree. Anything the evaluator can
 * compute is listed here; there is no other operator.
 */
@Getter
@RequiredArgsConstructor
public enum NodeKind {

    NUMBER(""),
    NEGATE("-"),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    public boolean isBinary() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE;
    }

    /**
     * Commutative operators get their flattened operands sorted when canonicalized.
     */
    public boolean isCommutative() {
        return this == ADD || this == MULTIPLY;
    }
}
