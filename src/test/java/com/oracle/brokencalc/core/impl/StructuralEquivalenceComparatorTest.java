package com.oracle.brokencalc.core.impl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralEquivalenceComparatorTest {

    private final StructuralEquivalenceComparator comparator = new StructuralEquivalenceComparator();

    @Test
    void commutativeReorderingIsEquivalent() {
        assertTrue(comparator.areEquivalent("9+1", "1+9"));
        assertTrue(comparator.areEquivalent("5*2", "2*5"));
        assertTrue(comparator.areEquivalent("3+2*4", "2*4+3"));
        assertTrue(comparator.areEquivalent("(9+1)", "(1+9)"));
        assertTrue(comparator.areEquivalent("2*3+4", "3*2+4"));
        assertTrue(comparator.areEquivalent("1+2+3", "3+(2+1)"));
        assertTrue(comparator.areEquivalent("-(2+5)", "-(5+2)"));
    }

    @Test
    void differentOperandsAreNotEquivalent() {
        assertFalse(comparator.areEquivalent("2+8", "1+9"));
        assertFalse(comparator.areEquivalent("6/2", "2*3"));
    }

    @Test
    void orderMattersForSubtractionAndDivision() {
        assertFalse(comparator.areEquivalent("10-5", "5-10"));
        assertFalse(comparator.areEquivalent("9-1", "1-9"));
        assertFalse(comparator.areEquivalent("8/2", "2/8"));
        assertFalse(comparator.areEquivalent("8-2-1", "8-(2-1)"));
    }

    @Test
    void sameOperandsInADifferentStructureAreNotEquivalent() {
        assertFalse(comparator.areEquivalent("2*3+4", "2*(3+4)"));
        assertFalse(comparator.areEquivalent("-2+5", "-(2+5)"));
    }

    @Test
    void whitespaceAndLiteralSpellingAreIgnored() {
        assertTrue(comparator.areEquivalent("9 + 1", "9+1"));
        assertTrue(comparator.areEquivalent("2.0+1", "1+2"));
    }

    @Test
    void unparsableEquationsOnlyMatchIdenticalText() {
        assertTrue(comparator.areEquivalent("2+", "2 +"));
        assertFalse(comparator.areEquivalent("2+", "3+"));
        assertFalse(comparator.areEquivalent("2+", "2"));
    }

    @Test
    void equivalenceIsReflexiveAndSymmetric() {
        List<String> equations = List.of("9+1", "1+9", "10-5", "5-10", "3+2*4", "2*4+3", "6/2", "2*3", "-(5+2)");
        for (String a : equations) {
            assertTrue(comparator.areEquivalent(a, a), a);
            for (String b : equations) {
                assertEquals(comparator.areEquivalent(a, b), comparator.areEquivalent(b, a), a + " / " + b);
            }
        }
    }

    @Test
    void uniqueIsTheNegation() {
        assertFalse(comparator.areUnique("9+1", "1+9"));
        assertTrue(comparator.areUnique("2+8", "1+9"));
    }

    @Test
    void tooDeeplyNestedEquationsCompareByText() {
        String deep = "(".repeat(20000) + "1+9" + ")".repeat(20000);
        String reordered = "(".repeat(20000) + "9+1" + ")".repeat(20000);
        String negations = "-".repeat(20000) + "1";

        assertTrue(comparator.areEquivalent(deep, deep.replace("+", " + ")));
        assertFalse(comparator.areEquivalent(deep, reordered));
        assertFalse(comparator.areEquivalent(negations, "1"));
        assertFalse(comparator.areEquivalent(negations, "-" + negations));
    }

    @Test
    void nonAsciiDigitsDoNotParse() {
        assertFalse(comparator.areEquivalent("\u0663+1", "1+\u0663"));
        assertFalse(comparator.areEquivalent("\u0663+1", "3+1"));
    }
}
