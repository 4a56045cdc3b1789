package org.xcos.csp.exceptions;

import lombok.Getter;

@Getter
public class ModelNotFoundException extends CspException {

    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super("Model " + modelId + " not found");
        this.modelId = modelId;
    }
}
