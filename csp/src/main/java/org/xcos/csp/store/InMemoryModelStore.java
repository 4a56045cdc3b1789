package org.xcos.csp.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.stereotype.Repository;
import org.xcos.csp.model.CSPModel;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link ModelStore} kept in a {@link ConcurrentHashMap}. Models are lost on restart.
 * <p>
 * Definitions are stored and handed out as deep copies, so the snapshot held under an id
 * only ever changes through {@link #put(CSPModel)}.
 */
@Repository
public class InMemoryModelStore implements ModelStore {

    private final ConcurrentMap<String, CSPModel> models = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryModelStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean put(CSPModel model) {
        return models.put(model.getId(), copy(model)) != null;
    }

    @Override
    public Optional<CSPModel> get(String modelId) {
        return Optional.ofNullable(models.get(modelId)).map(this::copy);
    }

    private CSPModel copy(CSPModel model) {
        return objectMapper.convertValue(objectMapper.valueToTree(model), CSPModel.class);
    }
}
