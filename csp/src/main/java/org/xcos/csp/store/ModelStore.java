package org.xcos.csp.store;

import java.util.Optional;

import org.xcos.csp.model.CSPModel;

/**
 * Keyed storage of model definitions.
 *
 * <p><b>Consistency:</b> a put replaces the whole definition stored under the model's id
 * atomically; concurrent puts to the same id resolve to the last completed write. Readers
 * always observe a complete definition and cannot alter the stored one through it.
 */
public interface ModelStore {

    /**
     * Create or replace the model stored under {@code model.getId()}.
     *
     * @return true if a model with that id was replaced, false if it was created
     */
    boolean put(CSPModel model);

    /**
     * @return a copy of the stored model, or empty if the id is unknown
     */
    Optional<CSPModel> get(String modelId);
}
