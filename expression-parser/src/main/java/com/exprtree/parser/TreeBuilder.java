package com.exprtree.parser;

import com.exprtree.ast.ASTNode;
import com.exprtree.ast.BinaryOperationNode;
import com.exprtree.ast.ErrorKind;
import com.exprtree.ast.ExpressionException;
import com.exprtree.ast.NumberNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds a single-rooted tree from postfix tokens using an operand stack.
 */
public class TreeBuilder {

    public ASTNode build(List<Token> postfix) {
        Deque<ASTNode> stack = new ArrayDeque<>();

        for (Token tk : postfix) {
            if (tk.isNumber()) {
                stack.push(new NumberNode(tk.getValue()));
            } else if (tk.isOperator()) {
                if (stack.size() < 2) {
                    throw new ExpressionException(ErrorKind.INSUFFICIENT_OPERANDS,
                            "Invalid expression: not enough operands for operator");
                }
                // right operand was pushed last
                ASTNode right = stack.pop();
                ASTNode left = stack.pop();
                stack.push(new BinaryOperationNode(left, right, tk.getOperator()));
            } else {
                throw new IllegalStateException("Parenthesis in postfix input at position " + tk.getPosition());
            }
        }

        if (stack.size() != 1) {
            throw new ExpressionException(ErrorKind.INVALID_EXPRESSION, "Invalid expression");
        }
        return stack.pop();
    }
}
