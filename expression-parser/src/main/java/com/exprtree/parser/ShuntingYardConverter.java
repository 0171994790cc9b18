package com.exprtree.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts infix tokens to postfix (RPN) order with the Shunting-Yard algorithm.
 *
 * An incoming operator first pops every stacked operator of greater or equal
 * precedence, which makes operators of one precedence level left-associative.
 * Parentheses must already be balanced; {@link Parser#isValid(String)} guarantees that.
 */
public class ShuntingYardConverter {

    public List<Token> toPostfix(List<Token> tokens) {
        List<Token> output = new ArrayList<>();
        Deque<Token> opStack = new ArrayDeque<>();

        for (Token tk : tokens) {
            switch (tk.getType()) {
                case NUMBER:
                    output.add(tk);
                    break;

                case OPERATOR:
                    while (!opStack.isEmpty()
                            && opStack.peek().isOperator()
                            && opStack.peek().getOperator().getPrecedence() >= tk.getOperator().getPrecedence()) {
                        output.add(opStack.pop());
                    }
                    opStack.push(tk);
                    break;

                case LEFT_PAREN:
                    opStack.push(tk);
                    break;

                case RIGHT_PAREN:
                    while (!opStack.isEmpty() && opStack.peek().getType() != TokenType.LEFT_PAREN) {
                        output.add(opStack.pop());
                    }
                    if (opStack.isEmpty()) {
                        throw new IllegalStateException("Unmatched ')' at position " + tk.getPosition());
                    }
                    opStack.pop();
                    break;
            }
        }

        while (!opStack.isEmpty()) {
            Token tk = opStack.pop();
            if (!tk.isOperator()) {
                throw new IllegalStateException("Unmatched '(' at position " + tk.getPosition());
            }
            output.add(tk);
        }

        return output;
    }
}
