package org.xcos.csp.exceptions;

/**
 * Base type for every failure raised while compiling, solving or decoding a CSP model.
 *
 * Unchecked, so the pipeline stages can stay free of throws clauses; the
 * solve entry point and the REST layer are the places that catch it.
 */
public class CspException extends RuntimeException {

    public CspException(String message) {
        super(message);
    }

    public CspException(String message, Throwable cause) {
        super(message, cause);
    }
}
