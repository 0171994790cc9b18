package com.exprtree.ast;

/**
 * The closed set of binary operators. Comparisons share precedence with
 * the additive operators and are not chainable.
 */
public enum Operator {
    ADD("+", 1),
    SUBTRACT("-", 1),
    MULTIPLY("*", 2),
    DIVIDE("/", 2),
    LESS_THAN("<", 1),
    GREATER_THAN(">", 1),
    EQUALS("=", 1);

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    /**
     * Resolve an operator from its one-character symbol.
     *
     * @throws ExpressionException with {@link ErrorKind#UNKNOWN_OPERATOR} for any other symbol
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new ExpressionException(ErrorKind.UNKNOWN_OPERATOR, "Unknown operator: " + symbol);
    }

    public static boolean isOperator(char c) {
        for (Operator op : values()) {
            if (op.symbol.charAt(0) == c) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
