package org.xcos.csp.expression.ir;

import lombok.Getter;

@Getter
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }
}
