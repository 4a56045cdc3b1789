package org.xcos.csp.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.xcos.csp.exceptions.InvalidModelException;
import org.xcos.csp.exceptions.ModelNotFoundException;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.output.ModelStoredResponse;
import org.xcos.csp.parser.Yaml2Model;
import org.xcos.csp.store.ModelStore;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Create, replace and look up model definitions.
 */
@Slf4j
@Service
public class ModelService {

    private final ModelStore modelStore;
    private final ModelValidator modelValidator;
    private final ObjectMapper objectMapper;

    public ModelService(ModelStore modelStore, ModelValidator modelValidator, ObjectMapper objectMapper) {
        this.modelStore = modelStore;
        this.modelValidator = modelValidator;
        this.objectMapper = objectMapper;
    }

    public ModelStoredResponse storeModel(CSPModel model) {
        normalize(model);
        modelValidator.validate(model);
        boolean replaced = modelStore.put(model);
        log.info("{} model '{}' ({} variables, {} constraints)", replaced ? "Updated" : "Created",
            model.getId(), model.getVariables().size(), model.getConstraints().size());
        return new ModelStoredResponse("success", model.getId(), "Model '" + model.getName() + "' stored successfully");
    }

    /**
     * Reads a YAML model definition and stores it like {@link #storeModel(CSPModel)}.
     */
    public ModelStoredResponse importModel(MultipartFile file) {
        CSPModel model = Yaml2Model.retrieveModelFromYaml(file, objectMapper);
        return storeModel(model);
    }

    public CSPModel getModel(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            throw new InvalidModelException(List.of("model_id is required"));
        }
        return modelStore.get(modelId).orElseThrow(() -> new ModelNotFoundException(modelId));
    }

    // Explicit JSON nulls become empty collections
    private static void normalize(CSPModel model) {
        if (model.getVariables() == null) {
            model.setVariables(new ArrayList<>());
        }
        if (model.getConstraints() == null) {
            model.setConstraints(new ArrayList<>());
        }
        if (model.getMetadata() == null) {
            model.setMetadata(new HashMap<>());
        }
    }
}
