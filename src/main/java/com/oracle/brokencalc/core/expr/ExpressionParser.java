package com.oracle.brokencalc.core.expr;

import java.util.List;

/**
 * Recursive-descent parser for infix arithmetic:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | primary
 * primary    := NUMBER | '(' expression ')'
 * </pre>
 * Binary operators are left-associative. There is no unary plus and no
 * implicit multiplication, so {@code +2} and {@code 2(3)} are syntax errors.
 * <p>
 * Parentheses, negations and the resulting tree are limited to
 * {@link #MAX_DEPTH} levels so every later tree walk stays shallow.
 * <p>
 * Instances are single-use; call {@link #parse(String)} for the common case.
 */
public class ExpressionParser {

    public static final int MAX_DEPTH = 200;

    private final List<Token> tokens;
    private int index;
    private int nesting;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static ExpressionNode parse(String text) {
        if (text == null) {
            throw new ExpressionSyntaxException("Expression is missing", -1);
        }
        ExpressionParser parser = new ExpressionParser(new ExpressionLexer(text).tokenize());
        ExpressionNode root = parser.parseExpression();
        parser.expect(TokenType.EOF);
        return root;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode node = parseTerm();
        while (peek().getType() == TokenType.PLUS || peek().getType() == TokenType.MINUS) {
            Token operator = advance();
            NodeKind kind = operator.getType() == TokenType.PLUS ? NodeKind.ADD : NodeKind.SUBTRACT;
            node = limitHeight(ExpressionNode.binary(kind, node, parseTerm()), operator);
        }
        return node;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode node = parseUnary();
        while (peek().getType() == TokenType.STAR || peek().getType() == TokenType.SLASH) {
            Token operator = advance();
            NodeKind kind = operator.getType() == TokenType.STAR ? NodeKind.MULTIPLY : NodeKind.DIVIDE;
            node = limitHeight(ExpressionNode.binary(kind, node, parseUnary()), operator);
        }
        return node;
    }

    private ExpressionNode parseUnary() {
        if (peek().getType() == TokenType.MINUS) {
            Token minus = advance();
            descend(minus);
            ExpressionNode operand = parseUnary();
            nesting--;
            return limitHeight(ExpressionNode.negate(operand), minus);
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        Token token = advance();
        switch (token.getType()) {
            case NUMBER:
                return ExpressionNode.number(token.getText());
            case LPAREN:
                descend(token);
                ExpressionNode inner = parseExpression();
                expect(TokenType.RPAREN);
                nesting--;
                return inner;
            case PLUS:
                throw new ExpressionSyntaxException("Unary plus is not supported", token.getPosition());
            default:
                throw unexpected(token);
        }
    }

    private void descend(Token token) {
        if (++nesting > MAX_DEPTH) {
            throw tooDeep(token);
        }
    }

    private ExpressionNode limitHeight(ExpressionNode node, Token token) {
        if (node.getHeight() > MAX_DEPTH) {
            throw tooDeep(token);
        }
        return node;
    }

    private ExpressionSyntaxException tooDeep(Token token) {
        return new ExpressionSyntaxException("Expression is nested too deeply", token.getPosition());
    }

    private void expect(TokenType type) {
        Token token = advance();
        if (token.getType() != type) {
            if (type == TokenType.RPAREN && token.getType() == TokenType.EOF) {
                throw new ExpressionSyntaxException("Missing closing parenthesis", token.getPosition());
            }
            throw unexpected(token);
        }
    }

    private ExpressionSyntaxException unexpected(Token token) {
        if (token.getType() == TokenType.EOF) {
            return new ExpressionSyntaxException("Unexpected end of expression", token.getPosition());
        }
        return new ExpressionSyntaxException(
                "Unexpected " + token.describe() + " at position " + token.getPosition(), token.getPosition());
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.getType() != TokenType.EOF) {
            index++;
        }
        return token;
    }
}
