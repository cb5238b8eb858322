package com.oracle.brokencalc.core.expr;

import com.oracle.brokencalc.model.EquationSignature;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignatureExtractorTest {

    private final SignatureExtractor extractor = new SignatureExtractor();

    @Test
    void countsOperandsOperatorsAndCanonicalForm() {
        EquationSignature signature = extractor.extract("9+1+9").orElseThrow();

        assertEquals(Map.of(new BigDecimal("1"), 1, new BigDecimal("9"), 2), signature.getOperands());
        assertEquals(Map.of(NodeKind.ADD, 2), signature.getOperators());
        assertEquals("(1+9+9)", signature.getCanonicalForm());
    }

    @Test
    void negationCountsAsItsOwnOperator() {
        EquationSignature signature = extractor.extract("-5*2").orElseThrow();

        assertEquals(Map.of(new BigDecimal("5"), 1, new BigDecimal("2"), 1), signature.getOperands());
        assertEquals(Map.of(NodeKind.NEGATE, 1, NodeKind.MULTIPLY, 1), signature.getOperators());
    }

    @Test
    void equalValuedLiteralsAreTheSameOperand() {
        EquationSignature signature = extractor.extract("2.0+2").orElseThrow();

        assertEquals(Map.of(new BigDecimal("2"), 2), signature.getOperands());
    }

    @Test
    void reorderedEquationsHaveEqualSignatures() {
        assertEquals(extractor.extract("3+2*4"), extractor.extract("2*4+3"));
        assertNotEquals(extractor.extract("9-1"), extractor.extract("1-9"));
    }

    @Test
    void unparsableTextHasNoSignature() {
        assertTrue(extractor.extract("2+").isEmpty());
        assertTrue(extractor.extract("(1").isEmpty());
    }
}
