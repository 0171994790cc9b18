package com.exprtree.ast;

import java.math.BigDecimal;

/**
 * Numeric literal leaf.
 */
public class NumberNode implements ASTNode {

    private final double value;

    public NumberNode(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public Double evaluate() {
        return value;
    }

    @Override
    public String print() {
        return format(value);
    }

    @Override
    public SerializedASTNode serialize() {
        return SerializedASTNode.number(value);
    }

    /**
     * Shortest plain decimal form of a number: {@code 15}, {@code 1.2}, {@code 0.0001}.
     * Never carries a trailing {@code .0} or an exponent.
     */
    public static String format(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "Infinity" : "-Infinity";
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return "NumberNode[" + format(value) + "]";
    }
}
