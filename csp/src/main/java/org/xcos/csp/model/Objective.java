package org.xcos.csp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional optimisation target of a model: an integer-valued expression over the model's variables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Objective {
    @Builder.Default
    private ObjectiveSense sense = ObjectiveSense.MINIMIZE;
    private String expression;
}
