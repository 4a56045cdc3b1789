package org.xcos.csp.solver;

import java.util.Collections;
import java.util.Map;

import org.xcos.csp.encoding.EncodedVariable;

import lombok.Value;

@Value
public class SolverOutcome {
    SolverVerdict verdict;
    // Raw solver value per encoded variable; empty unless satisfiable
    Map<EncodedVariable, Integer> assignments;
    Integer objectiveValue;
    // True when the objective value was proven optimal
    boolean optimal;

    public static SolverOutcome satisfiable(Map<EncodedVariable, Integer> assignments, Integer objectiveValue, boolean optimal) {
        return new SolverOutcome(SolverVerdict.SATISFIABLE, Collections.unmodifiableMap(assignments), objectiveValue, optimal);
    }

    public static SolverOutcome unsatisfiable() {
        return new SolverOutcome(SolverVerdict.UNSATISFIABLE, Map.of(), null, false);
    }

    public static SolverOutcome unknown() {
        return new SolverOutcome(SolverVerdict.UNKNOWN, Map.of(), null, false);
    }
}
