package com.exprtree.parser;

import com.exprtree.ast.Operator;
import com.exprtree.ast.UnexpectedTokenException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a whitespace-stripped expression into number, operator and parenthesis tokens
 * in a single left-to-right pass.
 */
public class Tokenizer {

    private static final Pattern LEADING_DECIMAL = Pattern.compile("\\d*\\.?\\d*");

    public List<Token> tokenize(String s) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;

        while (i < s.length()) {
            char c = s.charAt(i);

            if (isNumberChar(c)) {
                int start = i;
                while (i < s.length() && isNumberChar(s.charAt(i))) i++;
                tokens.add(Token.number(parseLeadingDecimal(s.substring(start, i)), start));
            } else if (c == '(') {
                tokens.add(Token.leftParen(i++));
            } else if (c == ')') {
                tokens.add(Token.rightParen(i++));
            } else if (Operator.isOperator(c)) {
                tokens.add(Token.operator(Operator.fromSymbol(String.valueOf(c)), i++));
            } else {
                throw new UnexpectedTokenException(c, i);
            }
        }

        return tokens;
    }

    /**
     * Parse the longest valid decimal prefix of a run of digits and dots.
     * Whatever follows the prefix is dropped: "1.2.3" gives 1.2.
     * A prefix without any digit ("." or "..5") gives NaN.
     */
    static double parseLeadingDecimal(String run) {
        Matcher m = LEADING_DECIMAL.matcher(run);
        String prefix = m.lookingAt() ? m.group() : "";
        for (int i = 0; i < prefix.length(); i++) {
            if (Character.isDigit(prefix.charAt(i))) {
                return Double.parseDouble(prefix);
            }
        }
        return Double.NaN;
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }
}
