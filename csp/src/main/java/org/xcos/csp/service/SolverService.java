package org.xcos.csp.service;

import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.xcos.csp.assembly.AssembledModel;
import org.xcos.csp.assembly.ConstraintModelAssembler;
import org.xcos.csp.config.XcosProperties;
import org.xcos.csp.decoding.SolutionDecoder;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.output.SolveResult;
import org.xcos.csp.output.SolveStatus;
import org.xcos.csp.solver.SolverBackend;
import org.xcos.csp.solver.SolverOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Solve orchestration: assemble, run the solver under a time limit, classify and decode.
 * <p>
 * Every failure, whether it happens while compiling the model or inside the solver, is
 * reported as a {@link SolveStatus#ERROR} result; nothing escapes {@link #solve}.
 */
@Slf4j
@Service
public class SolverService {

    private final ConstraintModelAssembler assembler;
    private final SolverBackend solverBackend;
    private final SolutionDecoder solutionDecoder;
    private final XcosProperties properties;

    public SolverService(ConstraintModelAssembler assembler, SolverBackend solverBackend,
                         SolutionDecoder solutionDecoder, XcosProperties properties) {
        this.assembler = assembler;
        this.solverBackend = solverBackend;
        this.solutionDecoder = solutionDecoder;
        this.properties = properties;
    }

    /**
     * Solve a CSP model.
     *
     * @param model   the model to solve
     * @param timeout solver time limit in seconds, null for the configured default, non-positive for none
     * @param findAll accepted for compatibility; a single solution is returned either way
     * @return the classified outcome, never null
     */
    public SolveResult solve(CSPModel model, Integer timeout, boolean findAll) {
        int effectiveTimeout = timeout != null ? timeout : properties.getSolver().getDefaultTimeout();
        if (findAll) {
            log.warn("Model '{}': find_all requested, returning a single solution", model.getId());
        }
        try {
            AssembledModel assembled = assembler.assemble(model);

            long start = System.nanoTime();
            SolverOutcome outcome = solverBackend.solve(assembled, effectiveTimeout);
            double solveTimeMs = (System.nanoTime() - start) / 1_000_000.0;

            SolveResult result = classify(assembled, outcome, solveTimeMs, effectiveTimeout);
            log.info("Model '{}' solved: {} in {} ms", model.getId(), result.getStatus().getValue(),
                String.format(Locale.ROOT, "%.1f", solveTimeMs));
            return result;
        } catch (RuntimeException e) {
            log.warn("Model '{}' could not be solved: {}", model.getId(), e.getMessage());
            return SolveResult.error("Solver error: " + e.getMessage());
        }
    }

    private SolveResult classify(AssembledModel assembled, SolverOutcome outcome, double solveTimeMs, int timeout) {
        switch (outcome.getVerdict()) {
            case SATISFIABLE: {
                Map<String, Object> solution = solutionDecoder.decode(assembled, outcome.getAssignments());
                boolean optimal = assembled.hasObjective() && outcome.isOptimal();
                Integer objective = outcome.getObjectiveValue();
                return SolveResult.builder()
                    .status(optimal ? SolveStatus.OPTIMAL : SolveStatus.SATISFIABLE)
                    .solution(solution)
                    .objectiveValue(objective != null ? objective.doubleValue() : null)
                    .solveTimeMs(solveTimeMs)
                    .message(String.format(Locale.ROOT, "Found %s in %.1fms",
                        optimal ? "optimal solution" : "solution", solveTimeMs))
                    .build();
            }
            case UNSATISFIABLE:
                return SolveResult.builder()
                    .status(SolveStatus.UNSATISFIABLE)
                    .solveTimeMs(solveTimeMs)
                    .message("No solution exists for this model")
                    .build();
            default:
                return SolveResult.builder()
                    .status(SolveStatus.TIMEOUT)
                    .solveTimeMs(solveTimeMs)
                    .message("No solution found within the time limit of " + timeout + "s")
                    .build();
        }
    }
}
