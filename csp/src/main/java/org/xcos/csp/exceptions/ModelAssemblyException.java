package org.xcos.csp.exceptions;

import lombok.Getter;

/**
 * Aborts model assembly when one constraint fails to compile. No partial model survives it.
 */
@Getter
public class ModelAssemblyException extends CspException {

    private final String constraintId;
    private final String expression;

    public ModelAssemblyException(String constraintId, String expression, ExpressionException cause) {
        super("Failed to parse constraint '" + constraintId + "' \"" + expression + "\": " + cause.getReason(), cause);
        this.constraintId = constraintId;
        this.expression = expression;
    }
}
