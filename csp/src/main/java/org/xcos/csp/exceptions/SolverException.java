package org.xcos.csp.exceptions;

/**
 * Failure raised inside, or reported by, the solver backend.
 */
public class SolverException extends CspException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
