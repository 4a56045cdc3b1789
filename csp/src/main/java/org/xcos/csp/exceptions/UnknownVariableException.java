package org.xcos.csp.exceptions;

import lombok.Getter;

/**
 * Raised when an expression references a name that is not a declared variable.
 */
@Getter
public class UnknownVariableException extends ExpressionException {

    private final String identifier;

    public UnknownVariableException(String constraintId, String expression, String identifier) {
        super(constraintId, expression, "unknown variable '" + identifier + "'");
        this.identifier = identifier;
    }
}
