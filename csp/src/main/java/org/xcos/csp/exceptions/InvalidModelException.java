package org.xcos.csp.exceptions;

import java.util.List;

import lombok.Getter;

/**
 * A submitted model definition is structurally invalid (missing ids, duplicate names, bad weights, unreadable YAML).
 */
@Getter
public class InvalidModelException extends CspException {

    private final List<String> errors;

    public InvalidModelException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public InvalidModelException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }
}
