package org.xcos.csp.exceptions;

import lombok.Getter;

/**
 * Raised when a constraint expression violates the grammar or its type rules.
 * Carries the original expression text and, when known, the id of the constraint it belongs to.
 */
@Getter
public class ExpressionException extends CspException {

    private final String constraintId;
    private final String expression;
    private final String reason;

    public ExpressionException(String constraintId, String expression, String reason) {
        super(format(constraintId, expression, reason));
        this.constraintId = constraintId;
        this.expression = expression;
        this.reason = reason;
    }

    private static String format(String constraintId, String expression, String reason) {
        String prefix = constraintId != null ? "Constraint '" + constraintId + "'" : "Expression";
        return prefix + " \"" + expression + "\": " + reason;
    }
}
