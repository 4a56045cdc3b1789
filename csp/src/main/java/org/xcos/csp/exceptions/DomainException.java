package org.xcos.csp.exceptions;

import lombok.Getter;

/**
 * Raised when a variable's domain is empty or malformed.
 */
@Getter
public class DomainException extends CspException {

    private final String variableName;

    public DomainException(String variableName, String reason) {
        super("Variable '" + variableName + "': " + reason);
        this.variableName = variableName;
    }
}
