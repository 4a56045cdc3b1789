package org.xcos.csp.expression;

import lombok.Value;

@Value
class Token {
    TokenType type;
    String text;
    // 1-based column in the expression
    int column;

    boolean is(TokenType other) {
        return type == other;
    }
}
