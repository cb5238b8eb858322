package com.oracle.brokencalc.core.expr;

public enum TokenType {
    NUMBER, PLUS, MINUS, STAR, SLASH, LPAREN, RPAREN, EOF
}
