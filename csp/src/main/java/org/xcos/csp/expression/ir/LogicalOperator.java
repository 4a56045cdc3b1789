package org.xcos.csp.expression.ir;

public enum LogicalOperator {
    AND,
    OR,
    // Single operand
    NOT
}
