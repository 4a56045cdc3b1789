package org.xcos.csp.solver;

/**
 * What the solver can claim after a bounded search.
 */
public enum SolverVerdict {
    SATISFIABLE,
    // Proven: no assignment satisfies the constraints
    UNSATISFIABLE,
    // The limit was reached before a solution or a proof was found
    UNKNOWN
}
