package org.xcos.csp.exceptions;

/**
 * Internal invariant violation while mapping solver output back to domain values.
 */
public class DecodeException extends CspException {

    public DecodeException(String message) {
        super(message);
    }
}
