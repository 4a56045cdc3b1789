package org.xcos.csp.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.xcos.csp.exceptions.ExpressionException;

/**
 * Splits a constraint expression into tokens.
 * <p>
 * Operators from general-purpose languages that the constraint language does not offer
 * ({@code %}, {@code **}, {@code //}, {@code =}, {@code .}, ...) are recognised here only to be
 * rejected with a precise message.
 */
class ExpressionTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "and", TokenType.AND,
        "or", TokenType.OR,
        "not", TokenType.NOT);

    private static final Map<String, TokenType> TWO_CHAR_OPERATORS = Map.of(
        "==", TokenType.EQ,
        "!=", TokenType.NE,
        "<=", TokenType.LE,
        ">=", TokenType.GE);

    private static final Map<Character, TokenType> ONE_CHAR_OPERATORS = Map.ofEntries(
        Map.entry('<', TokenType.LT),
        Map.entry('>', TokenType.GT),
        Map.entry('+', TokenType.PLUS),
        Map.entry('-', TokenType.MINUS),
        Map.entry('*', TokenType.STAR),
        Map.entry('/', TokenType.SLASH),
        Map.entry('&', TokenType.AND),
        Map.entry('|', TokenType.OR),
        Map.entry('~', TokenType.NOT),
        Map.entry('!', TokenType.NOT),
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry(',', TokenType.COMMA));

    private static final List<String> UNSUPPORTED_OPERATORS = List.of(
        "**", "//", "<<", ">>", "&&", "||", "->", "%", "^", "=", ".", "@", ":", ";", "?", "$", "{", "}");

    private final String constraintId;
    private final String expression;
    private int pos;

    ExpressionTokenizer(String constraintId, String expression) {
        this.constraintId = constraintId;
        this.expression = expression;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= expression.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos + 1));
                return tokens;
            }
            char c = expression.charAt(pos);
            if (Character.isDigit(c)) {
                tokens.add(readNumber());
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(readWord());
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < expression.length() && Character.isWhitespace(expression.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < expression.length() && Character.isDigit(expression.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < expression.length() && expression.charAt(pos) == '.'
            && Character.isDigit(expression.charAt(pos + 1))) {
            pos++;
            while (pos < expression.length() && Character.isDigit(expression.charAt(pos))) {
                pos++;
            }
        }
        if (pos < expression.length() && (Character.isLetter(expression.charAt(pos)) || expression.charAt(pos) == '_')) {
            throw error("malformed number '" + expression.substring(start, pos + 1) + "'", start);
        }
        return new Token(TokenType.NUMBER, expression.substring(start, pos), start + 1);
    }

    private Token readWord() {
        int start = pos;
        while (pos < expression.length()
            && (Character.isLetterOrDigit(expression.charAt(pos)) || expression.charAt(pos) == '_')) {
            pos++;
        }
        String word = expression.substring(start, pos);
        TokenType keyword = KEYWORDS.get(word);
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, word, start + 1);
    }

    private Token readOperator() {
        int start = pos;
        char first = expression.charAt(pos);
        if (first == '"' || first == '\'') {
            throw error("string literals are not supported, compare against a domain index instead", start);
        }
        for (String unsupported : UNSUPPORTED_OPERATORS) {
            if (expression.startsWith(unsupported, pos) && !isSupportedPrefix(unsupported)) {
                throw error("unsupported operator '" + unsupported + "'", start);
            }
        }
        if (pos + 1 < expression.length()) {
            String pair = expression.substring(pos, pos + 2);
            TokenType type = TWO_CHAR_OPERATORS.get(pair);
            if (type != null) {
                pos += 2;
                return new Token(type, pair, start + 1);
            }
        }
        char c = expression.charAt(pos);
        TokenType type = ONE_CHAR_OPERATORS.get(c);
        if (type == null) {
            throw error("unexpected character '" + c + "'", start);
        }
        pos++;
        return new Token(type, String.valueOf(c), start + 1);
    }

    // A lone '=' must not shadow '==', '<=', '>=' or '!='
    private boolean isSupportedPrefix(String unsupported) {
        return unsupported.equals("=") && expression.startsWith("==", pos);
    }

    private ExpressionException error(String reason, int offset) {
        return new ExpressionException(constraintId, expression, reason + " at column " + (offset + 1));
    }
}
