package com.oracle.brokencalc.core.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits equation text into tokens. Accepts digits, '.', the four operators,
 * parentheses and whitespace; anything else is a syntax error.
 */
public class ExpressionLexer {

    private final String source;
    private int pos;

    public ExpressionLexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (isDigit(c) || c == '.') {
                tokens.add(readNumber());
            } else {
                tokens.add(new Token(symbolType(c), String.valueOf(c), pos));
                pos++;
            }
        }
        tokens.add(new Token(TokenType.EOF, "", source.length()));
        return tokens;
    }

    private Token readNumber() {
        int start = pos;
        int dots = 0;
        int digits = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '.') {
                dots++;
            } else if (isDigit(c)) {
                digits++;
            } else {
                break;
            }
            pos++;
        }
        String literal = source.substring(start, pos);
        if (dots > 1 || digits == 0) {
            throw new ExpressionSyntaxException("Malformed number '" + literal + "'", start);
        }
        return new Token(TokenType.NUMBER, literal, start);
    }

    // ASCII only; Character.isDigit also accepts other scripts' digits
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private TokenType symbolType(char c) {
        switch (c) {
            case '+':
                return TokenType.PLUS;
            case '-':
                return TokenType.MINUS;
            case '*':
                return TokenType.STAR;
            case '/':
                return TokenType.SLASH;
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            default:
                throw new ExpressionSyntaxException("Unexpected character '" + c + "'", pos);
        }
    }
}
