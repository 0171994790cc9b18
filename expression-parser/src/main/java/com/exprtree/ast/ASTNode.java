package com.exprtree.ast;

/**
 * A node of an immutable expression tree.
 */
public interface ASTNode {

    /**
     * Evaluate this subtree.
     *
     * @return a {@link Double} for arithmetic results, a {@link Boolean} for comparisons
     */
    Object evaluate();

    /**
     * Render this subtree in fully parenthesized infix form, e.g. {@code ((1 + 2) * 3)}.
     */
    String print();

    /**
     * Project this subtree onto its structural, behavior-free form.
     */
    SerializedASTNode serialize();
}
