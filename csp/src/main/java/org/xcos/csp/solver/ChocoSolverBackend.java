package org.xcos.csp.solver;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.IntStream;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.Solution;
import org.chocosolver.solver.Solver;
import org.chocosolver.solver.constraints.Constraint;
import org.chocosolver.solver.variables.IntVar;
import org.springframework.stereotype.Component;
import org.xcos.csp.assembly.AssembledModel;
import org.xcos.csp.assembly.CompiledConstraint;
import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.CspException;
import org.xcos.csp.exceptions.SolverException;
import org.xcos.csp.model.ObjectiveSense;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link SolverBackend} on top of the Choco solver. Each call builds and discards its own Choco model.
 */
@Slf4j
@Component
public class ChocoSolverBackend implements SolverBackend {

    @Override
    public SolverOutcome solve(AssembledModel assembled, Integer timeLimitSeconds) {
        try {
            return doSolve(assembled, timeLimitSeconds);
        } catch (CspException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SolverException("Choco solver failed: " + e.getMessage(), e);
        }
    }

    private SolverOutcome doSolve(AssembledModel assembled, Integer timeLimitSeconds) {
        // 1) Variables
        Model model = new Model(assembled.getName() != null ? assembled.getName() : "csp");
        Map<EncodedVariable, IntVar> intVars = new LinkedHashMap<>();
        for (EncodedVariable variable : assembled.getVariables().values()) {
            intVars.put(variable, defineIntVar(model, variable));
        }

        // 2) Constraints, named after their ids so the Choco model stays readable
        ChocoExpressionTranslator translator = new ChocoExpressionTranslator(model, intVars);
        for (CompiledConstraint compiled : assembled.getConstraints()) {
            Constraint constraint = translator.toConstraint(compiled.getNode());
            constraint.setName(compiled.getId());
            constraint.post();
        }

        // 3) Search
        Solver solver = model.getSolver();
        if (timeLimitSeconds != null && timeLimitSeconds > 0) {
            solver.limitTime(timeLimitSeconds * 1000L);
        }

        IntVar objective = null;
        Solution solution;
        if (assembled.hasObjective()) {
            objective = translator.toIntVar(assembled.getObjective());
            solution = solver.findOptimalSolution(objective, assembled.getObjectiveSense() == ObjectiveSense.MAXIMIZE);
        } else {
            solution = solver.findSolution();
        }
        boolean limitReached = solver.isStopCriterionMet();
        log.debug("Choco search on '{}' finished: {}", model.getName(), solver.getMeasures());

        // 4) Verdict
        if (solution == null) {
            return limitReached ? SolverOutcome.unknown() : SolverOutcome.unsatisfiable();
        }
        Map<EncodedVariable, Integer> assignments = new HashMap<>();
        for (Map.Entry<EncodedVariable, IntVar> entry : intVars.entrySet()) {
            assignments.put(entry.getKey(), solution.getIntVal(entry.getValue()));
        }
        Integer objectiveValue = objective != null ? solution.getIntVal(objective) : null;
        return SolverOutcome.satisfiable(assignments, objectiveValue, objective != null && !limitReached);
    }

    private static IntVar defineIntVar(Model model, EncodedVariable variable) {
        if (variable.isIndexed()) {
            return model.intVar(variable.getName(), variable.getLowerBound(), variable.getUpperBound());
        }
        // Enumerated domain, so values inside [lb, ub] that were never declared stay excluded
        int[] values = IntStream.of(variable.getIntegerValues()).distinct().sorted().toArray();
        return model.intVar(variable.getName(), values);
    }
}
