package com.exprtree.parser;

import com.exprtree.ast.NumberNode;
import com.exprtree.ast.Operator;

import java.util.Objects;

/**
 * One lexical unit: a number, an operator, or a parenthesis.
 */
public final class Token {

    private final TokenType type;
    private final double value;
    private final Operator operator;
    private final int position;

    private Token(TokenType type, double value, Operator operator, int position) {
        this.type = type;
        this.value = value;
        this.operator = operator;
        this.position = position;
    }

    public static Token number(double value, int position) {
        return new Token(TokenType.NUMBER, value, null, position);
    }

    public static Token operator(Operator operator, int position) {
        return new Token(TokenType.OPERATOR, 0, operator, position);
    }

    public static Token leftParen(int position) {
        return new Token(TokenType.LEFT_PAREN, 0, null, position);
    }

    public static Token rightParen(int position) {
        return new Token(TokenType.RIGHT_PAREN, 0, null, position);
    }

    public TokenType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == TokenType.NUMBER;
    }

    public boolean isOperator() {
        return type == TokenType.OPERATOR;
    }

    public double getValue() {
        return value;
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * Start index in the whitespace-stripped input.
     */
    public int getPosition() {
        return position;
    }

    /**
     * Source-like text of the token: the number's printed form or the symbol.
     */
    public String getText() {
        switch (type) {
            case NUMBER: return NumberNode.format(value);
            case OPERATOR: return operator.getSymbol();
            case LEFT_PAREN: return "(";
            default: return ")";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Token token = (Token) o;
        return type == token.type
                && Double.compare(value, token.value) == 0
                && operator == token.operator
                && position == token.position;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, operator, position);
    }

    @Override
    public String toString() {
        return getText();
    }
}
