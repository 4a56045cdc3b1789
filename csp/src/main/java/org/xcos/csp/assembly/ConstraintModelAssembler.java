package org.xcos.csp.assembly;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.xcos.csp.encoding.DomainEncoder;
import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.ExpressionException;
import org.xcos.csp.exceptions.ModelAssemblyException;
import org.xcos.csp.expression.ExpressionCompiler;
import org.xcos.csp.expression.ir.IrNode;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.model.Constraint;
import org.xcos.csp.model.ConstraintType;
import org.xcos.csp.model.Objective;
import org.xcos.csp.model.ObjectiveSense;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link CSPModel} into an {@link AssembledModel}.
 * <p>
 * Disabled constraints are skipped. Soft constraints are posted exactly like hard ones:
 * weights are not applied yet, so a model with soft constraints may be over-constrained.
 */
@Slf4j
@Component
public class ConstraintModelAssembler {

    private final DomainEncoder domainEncoder;
    private final ExpressionCompiler expressionCompiler;

    public ConstraintModelAssembler(DomainEncoder domainEncoder, ExpressionCompiler expressionCompiler) {
        this.domainEncoder = domainEncoder;
        this.expressionCompiler = expressionCompiler;
    }

    public AssembledModel assemble(CSPModel model) {
        // 1) Encode domains
        Map<String, EncodedVariable> variables = domainEncoder.encodeAll(model.getVariables());

        // 2) Compile enabled constraints, all or nothing
        List<CompiledConstraint> compiled = new ArrayList<>();
        List<String> softIds = new ArrayList<>();
        for (Constraint constraint : model.getConstraints()) {
            if (!constraint.isEnabled()) {
                continue;
            }
            IrNode node;
            try {
                node = expressionCompiler.compile(constraint.getId(), constraint.getExpression(), variables);
            } catch (ExpressionException e) {
                throw new ModelAssemblyException(constraint.getId(), constraint.getExpression(), e);
            }
            if (constraint.getType() == ConstraintType.SOFT) {
                softIds.add(constraint.getId());
            }
            compiled.add(new CompiledConstraint(constraint.getId(), constraint.getExpression(), constraint.getType(), node));
        }
        if (!softIds.isEmpty()) {
            log.warn("Model '{}': soft constraints {} are posted as hard constraints, weights are not applied",
                model.getId(), softIds);
        }

        // 3) Objective, if any
        Objective objective = model.getObjective();
        IrNode objectiveNode = null;
        ObjectiveSense sense = null;
        if (objective != null) {
            try {
                objectiveNode = expressionCompiler.compileObjective(objective.getExpression(), variables);
            } catch (ExpressionException e) {
                throw new ModelAssemblyException("objective", objective.getExpression(), e);
            }
            sense = objective.getSense() != null ? objective.getSense() : ObjectiveSense.MINIMIZE;
        }

        log.debug("Assembled model '{}': {} variables, {} constraints", model.getId(), variables.size(), compiled.size());
        return new AssembledModel(model.getName(), variables, compiled, objectiveNode, sense);
    }
}
