package com.oracle.brokencalc.core.expr;

import lombok.Value;

@Value
public class Token {
    TokenType type;
    String text;
    int position;

    public String describe() {
        return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
    }
}
