package com.oracle.brokencalc.model;

import com.oracle.brokencalc.core.expr.NodeKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Structural fingerprint of an equation: how often each operand value and each
 * operator occurs, plus the canonical form. Two signatures are equal iff all three match.
 */
@Value
public class EquationSignature {
    Map<BigDecimal, Integer> operands;
    Map<NodeKind, Integer> operators;
    String canonicalForm;
}
