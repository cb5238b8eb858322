package com.oracle.brokencalc.core;

public interface EquivalenceComparator {

    /**
     * Whether two equations are the same solution up to reordering operands of + and *.
     * Equations that do not parse are only equivalent to identical text.
     */
    boolean areEquivalent(String first, String second);

    default boolean areUnique(String first, String second) {
        return !areEquivalent(first, second);
    }
}
