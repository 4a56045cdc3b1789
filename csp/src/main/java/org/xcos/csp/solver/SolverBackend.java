package org.xcos.csp.solver;

import org.xcos.csp.assembly.AssembledModel;

/**
 * Contract of the external constraint solver: takes an assembled model and an optional
 * time limit, answers with a verdict and, when satisfiable, a value for every variable.
 * Implementations must not keep state between calls.
 */
public interface SolverBackend {

    /**
     * @param model            the model to solve
     * @param timeLimitSeconds advisory limit honoured by the solver; null or non-positive means none
     * @return the verdict and assignments
     * @throws org.xcos.csp.exceptions.SolverException if the solver fails internally
     */
    SolverOutcome solve(AssembledModel model, Integer timeLimitSeconds);
}
