package org.xcos.csp.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.xcos.csp.assembly.AssembledModel;
import org.xcos.csp.assembly.CompiledConstraint;
import org.xcos.csp.assembly.ConstraintModelAssembler;
import org.xcos.csp.config.XcosProperties;
import org.xcos.csp.exceptions.UnsupportedExplanationException;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.output.ExplanationResult;
import org.xcos.csp.solver.SolverBackend;
import org.xcos.csp.solver.SolverVerdict;

import lombok.extern.slf4j.Slf4j;

/**
 * Explains why a model is unsatisfiable in terms of its constraint ids.
 * <ul>
 *   <li>{@code mus}: a minimal unsatisfiable subset, found by deletion. Every constraint
 *       left in it is needed for the conflict.</li>
 *   <li>{@code mcs}: a minimal correction set, the complement of a greedily grown
 *       satisfiable subset. Disabling it makes the model satisfiable.</li>
 * </ul>
 * Each probe is a full solver call under the configured default time limit. Probes the
 * solver cannot decide are treated conservatively, so the result is still a valid
 * conflict (or correction) but may not be minimal.
 */
@Slf4j
@Service
public class ConflictExplainer {

    private final ConstraintModelAssembler assembler;
    private final SolverBackend solverBackend;
    private final XcosProperties properties;

    public ConflictExplainer(ConstraintModelAssembler assembler, SolverBackend solverBackend, XcosProperties properties) {
        this.assembler = assembler;
        this.solverBackend = solverBackend;
        this.properties = properties;
    }

    public ExplanationResult explain(CSPModel model, String explanationType) {
        String type = explanationType == null ? "mus" : explanationType.toLowerCase(Locale.ROOT);
        if (!type.equals("mus") && !type.equals("mcs")) {
            throw new UnsupportedExplanationException(explanationType);
        }

        AssembledModel assembled = assembler.assemble(model);
        List<CompiledConstraint> all = assembled.getConstraints();
        SolverVerdict verdict = check(assembled, all);
        if (verdict == SolverVerdict.SATISFIABLE) {
            return new ExplanationResult(type, List.of(), "The model is satisfiable, there is no conflict to explain");
        }
        if (verdict == SolverVerdict.UNKNOWN) {
            return new ExplanationResult(type, List.of(),
                "The solver could not decide the model within the time limit, no explanation available");
        }

        ExplanationResult result = type.equals("mus") ? minimalUnsatisfiableSubset(assembled) : minimalCorrectionSet(assembled);
        log.info("Explained model '{}' with {} {}", model.getId(), type, result.getConstraintIds());
        return result;
    }

    private ExplanationResult minimalUnsatisfiableSubset(AssembledModel assembled) {
        List<CompiledConstraint> core = new ArrayList<>(assembled.getConstraints());
        for (CompiledConstraint candidate : assembled.getConstraints()) {
            List<CompiledConstraint> without = new ArrayList<>(core);
            without.remove(candidate);
            if (check(assembled, without) == SolverVerdict.UNSATISFIABLE) {
                core = without;
            }
        }
        List<String> ids = ids(core);
        return new ExplanationResult("mus", ids,
            "Constraints " + ids + " cannot all hold together; removing any one of them resolves this conflict");
    }

    private ExplanationResult minimalCorrectionSet(AssembledModel assembled) {
        List<CompiledConstraint> kept = new ArrayList<>();
        List<CompiledConstraint> correction = new ArrayList<>();
        for (CompiledConstraint candidate : assembled.getConstraints()) {
            kept.add(candidate);
            if (check(assembled, kept) != SolverVerdict.SATISFIABLE) {
                kept.remove(kept.size() - 1);
                correction.add(candidate);
            }
        }
        List<String> ids = ids(correction);
        return new ExplanationResult("mcs", ids,
            "Disabling constraints " + ids + " makes the model satisfiable");
    }

    private SolverVerdict check(AssembledModel assembled, List<CompiledConstraint> subset) {
        return solverBackend.solve(assembled.withConstraints(subset), properties.getSolver().getDefaultTimeout()).getVerdict();
    }

    private static List<String> ids(List<CompiledConstraint> constraints) {
        return constraints.stream().map(CompiledConstraint::getId).collect(Collectors.toList());
    }
}
