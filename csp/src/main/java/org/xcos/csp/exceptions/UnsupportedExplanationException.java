package org.xcos.csp.exceptions;

public class UnsupportedExplanationException extends CspException {

    public UnsupportedExplanationException(String explanationType) {
        super("Unsupported explanation type '" + explanationType + "'. Supported types: mus, mcs");
    }
}
