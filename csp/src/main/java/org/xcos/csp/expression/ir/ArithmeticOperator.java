package org.xcos.csp.expression.ir;

import lombok.Getter;

@Getter
public enum ArithmeticOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    // Integer division, truncated toward zero
    DIV("/");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }
}
