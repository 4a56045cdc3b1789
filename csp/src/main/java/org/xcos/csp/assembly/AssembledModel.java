package org.xcos.csp.assembly;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.expression.ir.IrNode;
import org.xcos.csp.model.ObjectiveSense;

import lombok.Value;

/**
 * Solver-ready model: encoded variables in declaration order, the enabled constraints
 * compiled to IR in declaration order, and the optional objective.
 */
@Value
public class AssembledModel {
    String name;
    Map<String, EncodedVariable> variables;
    List<CompiledConstraint> constraints;
    IrNode objective;
    ObjectiveSense objectiveSense;

    public AssembledModel(String name, Map<String, EncodedVariable> variables, List<CompiledConstraint> constraints,
                          IrNode objective, ObjectiveSense objectiveSense) {
        this.name = name;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.constraints = List.copyOf(constraints);
        this.objective = objective;
        this.objectiveSense = objectiveSense;
    }

    public boolean hasObjective() {
        return objective != null;
    }

    /**
     * Same variables, a different constraint subset and no objective. Used to probe subsets for explanations.
     */
    public AssembledModel withConstraints(List<CompiledConstraint> subset) {
        return new AssembledModel(name, variables, subset, null, null);
    }
}
