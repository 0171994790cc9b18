package com.exprtree.ast;

/**
 * Tokenizer failure for a character the expression language does not accept.
 */
public class UnexpectedTokenException extends ExpressionException {

    private final char token;
    private final int position;

    /**
     * @param token    the offending character
     * @param position zero-based index in the whitespace-stripped input
     */
    public UnexpectedTokenException(char token, int position) {
        super(ErrorKind.UNEXPECTED_TOKEN, "Unexpected token '" + token + "' at position " + position);
        this.token = token;
        this.position = position;
    }

    public char getToken() {
        return token;
    }

    public int getPosition() {
        return position;
    }
}
