package com.exprtree.parser;

import com.exprtree.ast.ASTNode;
import com.exprtree.ast.BinaryOperationNode;
import com.exprtree.ast.ErrorKind;
import com.exprtree.ast.ExpressionException;
import com.exprtree.ast.NumberNode;
import com.exprtree.ast.Operator;
import com.exprtree.ast.SerializedASTNode;
import com.exprtree.util.LoggingUtil;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Entry point of the expression pipeline:
 * parenthesis check, then {@link Tokenizer}, {@link ShuntingYardConverter} and {@link TreeBuilder}.
 *
 * All methods are stateless and safe to call from several threads.
 */
public final class Parser {

    private static final Tokenizer TOKENIZER = new Tokenizer();
    private static final ShuntingYardConverter CONVERTER = new ShuntingYardConverter();
    private static final TreeBuilder BUILDER = new TreeBuilder();

    // Unicode white space (NBSP, ideographic space, ...) plus the byte order mark
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);

    private Parser() {
    }

    /**
     * Check that parentheses are balanced. Every other character is ignored.
     *
     * @param s expression text
     * @return false on a ')' without an open '(' or on a '(' left open at the end
     */
    public static boolean isValid(String s) {
        int open = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                if (open == 0) return false;
                open--;
            }
        }
        return open == 0;
    }

    /**
     * Parse an infix expression into a tree.
     *
     * @param expr expression text; whitespace anywhere is ignored
     * @return the root node
     * @throws ExpressionException if the expression is malformed
     */
    public static ASTNode parse(String expr) {
        Objects.requireNonNull(expr, "expr");
        String s = WHITESPACE.matcher(expr).replaceAll("");
        if (!isValid(s)) {
            throw new ExpressionException(ErrorKind.INVALID_PARENTHESES, "Invalid or mismatched parentheses");
        }

        List<Token> tokens = TOKENIZER.tokenize(s);
        List<Token> postfix = CONVERTER.toPostfix(tokens);
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("parse: input='" + s + "' tokens=" + tokens + " postfix=" + postfix);
        }
        return BUILDER.build(postfix);
    }

    /**
     * Rebuild a tree from its serialized form. Children are rebuilt before their parent.
     *
     * @throws ExpressionException with {@link ErrorKind#UNRECOGNIZED_NODE_TYPE} for an unknown tag
     */
    public static ASTNode deserialize(SerializedASTNode serial) {
        Objects.requireNonNull(serial, "serial");
        String type = serial.getType() == null ? "" : serial.getType();

        switch (type) {
            case SerializedASTNode.NUMBER_NODE:
                if (serial.getValue() == null) {
                    throw new ExpressionException(ErrorKind.INVALID_EXPRESSION, "Invalid expression");
                }
                return new NumberNode(serial.getValue());

            case SerializedASTNode.BINARY_OPERATION_NODE:
                if (serial.getLeft() == null || serial.getRight() == null) {
                    throw new ExpressionException(ErrorKind.INVALID_EXPRESSION, "Invalid expression");
                }
                ASTNode leftNode = deserialize(serial.getLeft());
                ASTNode rightNode = deserialize(serial.getRight());
                return new BinaryOperationNode(leftNode, rightNode, Operator.fromSymbol(serial.getOperator()));

            default:
                throw new ExpressionException(ErrorKind.UNRECOGNIZED_NODE_TYPE, "Unrecognized serialized node type");
        }
    }
}
