package com.oracle.brokencalc.core.expr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalFormGeneratorTest {

    private final CanonicalFormGenerator generator = new CanonicalFormGenerator();

    @Test
    void commutativeOperandsAreSorted() {
        assertEquals("(1+9)", generator.canonicalize("9+1"));
        assertEquals("(1+9)", generator.canonicalize("1+9"));
        assertEquals("(2*5)", generator.canonicalize("5*2"));
        assertEquals("(10+9)", generator.canonicalize("9+10"));
    }

    @Test
    void sameOperatorChainsAreFlattened() {
        assertEquals("(1+9+9)", generator.canonicalize("9+1+9"));
        assertEquals("(1+9+9)", generator.canonicalize("9+9+1"));
        assertEquals("(1+2+3+4)", generator.canonicalize("(1+2)+(3+4)"));
        assertEquals("(1+2+3)", generator.canonicalize("3+(2+1)"));
        assertEquals("((2*3*4)+1)", generator.canonicalize("1+(2*3)*4"));
    }

    @Test
    void flatteningStopsAtADifferentOperator() {
        assertEquals("((1+2)*(3+4))", generator.canonicalize("(1+2)*(3+4)"));
        assertEquals("((2*5)+3)", generator.canonicalize("5*2+3"));
        assertEquals("((2*4)+3)", generator.canonicalize("3+2*4"));
        assertEquals("((2*4)+3)", generator.canonicalize("2*4+3"));
    }

    @Test
    void subtractionAndDivisionKeepTheirOrder() {
        assertEquals("(10-5)", generator.canonicalize("10-5"));
        assertEquals("(5-10)", generator.canonicalize("5-10"));
        assertEquals("(6/2)", generator.canonicalize("6/2"));
        assertEquals("((8-2)-1)", generator.canonicalize("8-2-1"));
        assertEquals("(8-(2-1))", generator.canonicalize("8-(2-1)"));
    }

    @Test
    void negationWrapsItsOperand() {
        assertEquals("(-5)", generator.canonicalize("-5"));
        assertEquals("(-(2+5))", generator.canonicalize("-(5+2)"));
        assertEquals("((-3)+10)", generator.canonicalize("10+-3"));
    }

    @Test
    void literalsUseNormalizedText() {
        assertEquals("(1+2.5)", generator.canonicalize("2.50+1"));
        assertEquals("(1+2)", generator.canonicalize("2.0 + 1"));
    }

    @Test
    void unparsableInputFallsBackToStrippedText() {
        assertEquals("2+)3", generator.canonicalize("2 + ) 3"));
        assertEquals("+2", generator.canonicalize(" +2 "));
    }

    @Test
    void canonicalizingACanonicalFormIsIdempotent() {
        List<String> equations = List.of(
                "9+1+9", "3+2*4", "(1+2)*(3+4)", "8-2-1", "-(5+2)", "10/4*2",
                "2.50+1", "1+(2*3)*4", "--3", "2 + ) 3");
        for (String equation : equations) {
            String once = generator.canonicalize(equation);
            assertEquals(once, generator.canonicalize(once), equation);
        }
    }

    @Test
    void tooDeeplyNestedInputFallsBackToStrippedText() {
        String deep = "(".repeat(5000) + "1 + 2" + ")".repeat(5000);

        assertEquals("(".repeat(5000) + "1+2" + ")".repeat(5000), generator.canonicalize(deep));
    }
}
