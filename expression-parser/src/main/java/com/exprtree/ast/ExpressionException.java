package com.exprtree.ast;

/**
 * Raised by the parser, the tree builder, evaluation and deserialization.
 * The {@link ErrorKind} tells callers which stage rejected the input.
 */
public class ExpressionException extends RuntimeException {

    private final ErrorKind kind;

    public ExpressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
