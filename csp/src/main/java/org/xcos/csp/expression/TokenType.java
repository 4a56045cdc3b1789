package org.xcos.csp.expression;

enum TokenType {
    NUMBER,
    IDENTIFIER,
    // Comparison
    EQ, NE, LT, GT, LE, GE,
    // Arithmetic
    PLUS, MINUS, STAR, SLASH,
    // Logical, symbol or keyword form
    AND, OR, NOT,
    LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA,
    EOF
}
