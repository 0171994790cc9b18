package com.exprtree.ast;

/**
 * Classifies every failure the parse/evaluate pipeline can report.
 */
public enum ErrorKind {
    /**
     * Unbalanced '(' / ')' in the whitespace-stripped input.
     */
    INVALID_PARENTHESES,

    /**
     * A character outside digits, '.', operators and parentheses.
     */
    UNEXPECTED_TOKEN,

    /**
     * An operator reached the tree builder with fewer than two operands available.
     */
    INSUFFICIENT_OPERANDS,

    /**
     * The tree builder did not end with exactly one root node.
     */
    INVALID_EXPRESSION,

    /**
     * Right operand of '/' evaluated to zero.
     */
    DIVISION_BY_ZERO,

    /**
     * Operator symbol outside the supported set.
     */
    UNKNOWN_OPERATOR,

    /**
     * Serialized node tag is neither NumberNode nor BinaryOperationNode.
     */
    UNRECOGNIZED_NODE_TYPE
}
