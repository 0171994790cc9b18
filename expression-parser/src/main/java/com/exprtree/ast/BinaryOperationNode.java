package com.exprtree.ast;

import java.util.Objects;

/**
 * Internal node applying one {@link Operator} to two owned subtrees.
 */
public class BinaryOperationNode implements ASTNode {

    private final ASTNode left;
    private final ASTNode right;
    private final Operator operator;

    public BinaryOperationNode(ASTNode left, ASTNode right, Operator operator) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public ASTNode getLeft() {
        return left;
    }

    public ASTNode getRight() {
        return right;
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * Evaluates left then right and applies the operator.
     * Arithmetic and ordering treat a boolean operand as 1 or 0;
     * '=' is strict and never equates a boolean with a number.
     */
    @Override
    public Object evaluate() {
        Object leftVal = left.evaluate();
        Object rightVal = right.evaluate();

        switch (operator) {
            case ADD:
                return toNumber(leftVal) + toNumber(rightVal);
            case SUBTRACT:
                return toNumber(leftVal) - toNumber(rightVal);
            case MULTIPLY:
                return toNumber(leftVal) * toNumber(rightVal);
            case DIVIDE:
                if (rightVal instanceof Double d && d == 0) {
                    throw new ExpressionException(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
                }
                return toNumber(leftVal) / toNumber(rightVal);
            case LESS_THAN:
                return toNumber(leftVal) < toNumber(rightVal);
            case GREATER_THAN:
                return toNumber(leftVal) > toNumber(rightVal);
            case EQUALS:
                return strictEquals(leftVal, rightVal);
            default:
                throw new ExpressionException(ErrorKind.UNKNOWN_OPERATOR, "Unknown operator: " + operator);
        }
    }

    @Override
    public String print() {
        return "(" + left.print() + " " + operator.getSymbol() + " " + right.print() + ")";
    }

    @Override
    public SerializedASTNode serialize() {
        return SerializedASTNode.binary(operator, left.serialize(), right.serialize());
    }

    private static double toNumber(Object val) {
        if (val instanceof Number n) return n.doubleValue();
        if (val instanceof Boolean b) return b ? 1 : 0;
        throw new IllegalStateException("Expected number or boolean operand but got: " + val);
    }

    private static boolean strictEquals(Object a, Object b) {
        if (a instanceof Double x && b instanceof Double y) {
            return x.doubleValue() == y.doubleValue();
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return x.booleanValue() == y.booleanValue();
        }
        return false;
    }

    @Override
    public String toString() {
        return "BinaryOperationNode" + print();
    }
}
