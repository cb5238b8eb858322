package com.oracle.brokencalc.core.impl;

import com.oracle.brokencalc.core.EquivalenceComparator;
import com.oracle.brokencalc.core.expr.CanonicalFormGenerator;
import com.oracle.brokencalc.core.expr.SignatureExtractor;
import com.oracle.brokencalc.model.EquationSignature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Two equations are equivalent when they use the same operands and operators
 * the same number of times and share a canonical form, e.g.
 * <ul>
 *   <li>{@code 9+1} and {@code 1+9}: equivalent</li>
 *   <li>{@code 2+8} and {@code 1+9}: different operands</li>
 *   <li>{@code 10-5} and {@code 5-10}: subtraction keeps its order</li>
 *   <li>{@code 3+2*4} and {@code 2*4+3}: equivalent</li>
 *   <li>{@code 6/2} and {@code 2*3}: same value, different equation</li>
 * </ul>
 */
@Component
@Slf4j
public class StructuralEquivalenceComparator implements EquivalenceComparator {

    private final SignatureExtractor signatureExtractor = new SignatureExtractor();

    @Override
    public boolean areEquivalent(String first, String second) {
        if (CanonicalFormGenerator.stripWhitespace(first).equals(CanonicalFormGenerator.stripWhitespace(second))) {
            return true;
        }

        Optional<EquationSignature> firstSignature = signatureExtractor.extract(first);
        Optional<EquationSignature> secondSignature = signatureExtractor.extract(second);
        if (firstSignature.isEmpty() || secondSignature.isEmpty()) {
            return false;
        }
        return compare(firstSignature.get(), secondSignature.get());
    }

    private boolean compare(EquationSignature a, EquationSignature b) {
        boolean sameOperands = a.getOperands().equals(b.getOperands());
        boolean sameOperators = a.getOperators().equals(b.getOperators());
        boolean sameForm = a.getCanonicalForm().equals(b.getCanonicalForm());

        // equal canonical forms imply equal multisets
        if (sameForm && !(sameOperands && sameOperators)) {
            log.error("Canonical form {} matched but operand/operator counts differ: {} vs {}",
                    a.getCanonicalForm(), a, b);
        }
        return sameOperands && sameOperators && sameForm;
    }
}
