package com.oracle.brokencalc.model;

public enum ValidationError {
    EMPTY_EQUATION,
    ILLEGAL_CHARACTER,
    UNARY_PLUS_NOT_ALLOWED,
    SYNTAX_ERROR,
    DIVISION_BY_ZERO,
    INVALID_EQUATION,
    /** Parses and evaluates, but not to the target. */
    VALUE_MISMATCH
}
