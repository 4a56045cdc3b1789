package org.xcos.csp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Constraint {
    private String id;
    private String expression;
    @Builder.Default
    private ConstraintType type = ConstraintType.HARD;
    // Soft constraints only, in [0, 1]
    private Double weight;
    private String description;
    @Builder.Default
    private boolean enabled = true;
}
