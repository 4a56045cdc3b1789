package org.xcos.csp.expression.ir;

/**
 * Static type of an IR node. Booleans may be used where integers are expected (as 0/1),
 * never the other way round; lists only appear as arguments of global constraints.
 */
public enum ValueType {
    INTEGER,
    BOOLEAN,
    LIST;

    public boolean isScalar() {
        return this != LIST;
    }
}
