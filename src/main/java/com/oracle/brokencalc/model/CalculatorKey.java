package com.oracle.brokencalc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The sixteen keys of the calculator pad, serialized as their symbols.
 */
@Getter
@RequiredArgsConstructor
public enum CalculatorKey {

    ZERO("0"),
    ONE("1"),
    TWO("2"),
    THREE("3"),
    FOUR("4"),
    FIVE("5"),
    SIX("6"),
    SEVEN("7"),
    EIGHT("8"),
    NINE("9"),
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")");

    @JsonValue
    private final String symbol;

    public boolean isDigit() {
        return ordinal() <= NINE.ordinal();
    }

    public int digitValue() {
        if (!isDigit()) {
            throw new IllegalStateException(symbol + " is not a digit key");
        }
        return ordinal();
    }

    public boolean isArithmeticOperator() {
        return this == PLUS || this == MINUS || this == MULTIPLY || this == DIVIDE;
    }

    @JsonCreator
    public static CalculatorKey fromSymbol(String symbol) {
        for (CalculatorKey key : values()) {
            if (key.symbol.equals(symbol)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown calculator key: " + symbol);
    }
}
