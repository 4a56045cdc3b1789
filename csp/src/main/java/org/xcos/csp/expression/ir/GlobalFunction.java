package org.xcos.csp.expression.ir;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

/**
 * The closed set of callable names an expression may use.
 */
@Getter
public enum GlobalFunction {
    ALL_DIFFERENT("AllDifferent", ValueType.BOOLEAN, false),
    ALL_EQUAL("AllEqual", ValueType.BOOLEAN, false),
    SUM("Sum", ValueType.INTEGER, false),
    MIN("Min", ValueType.INTEGER, false),
    MAX("Max", ValueType.INTEGER, false),
    ABS("Abs", ValueType.INTEGER, true);

    private final String keyword;
    private final ValueType resultType;
    private final boolean unary;

    GlobalFunction(String keyword, ValueType resultType, boolean unary) {
        this.keyword = keyword;
        this.resultType = resultType;
        this.unary = unary;
    }

    public static Optional<GlobalFunction> byKeyword(String keyword) {
        return Arrays.stream(values()).filter(f -> f.keyword.equals(keyword)).findFirst();
    }
}
