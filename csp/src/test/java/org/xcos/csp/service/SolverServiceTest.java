package org.xcos.csp.service;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.xcos.csp.assembly.AssembledModel;
import org.xcos.csp.assembly.ConstraintModelAssembler;
import org.xcos.csp.config.XcosProperties;
import org.xcos.csp.decoding.SolutionDecoder;
import org.xcos.csp.encoding.DomainEncoder;
import org.xcos.csp.exceptions.SolverException;
import org.xcos.csp.expression.ExpressionCompiler;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.model.Constraint;
import org.xcos.csp.model.ConstraintType;
import org.xcos.csp.model.Objective;
import org.xcos.csp.model.ObjectiveSense;
import org.xcos.csp.model.Variable;
import org.xcos.csp.output.SolveResult;
import org.xcos.csp.output.SolveStatus;
import org.xcos.csp.solver.ChocoSolverBackend;
import org.xcos.csp.solver.SolverBackend;
import org.xcos.csp.solver.SolverOutcome;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SolverServiceTest {

    private ConstraintModelAssembler assembler;
    private XcosProperties properties;
    private SolverService solverService;

    @BeforeEach
    void setUp() {
        assembler = new ConstraintModelAssembler(new DomainEncoder(), new ExpressionCompiler());
        properties = new XcosProperties();
        solverService = new SolverService(assembler, new ChocoSolverBackend(), new SolutionDecoder(), properties);
    }

    private static CSPModel model(List<Variable> variables, Constraint... constraints) {
        return CSPModel.builder().id("m1").name("Test").variables(variables).constraints(List.of(constraints)).build();
    }

    private static Constraint hard(String id, String expression) {
        return Constraint.builder().id(id).expression(expression).build();
    }

    @Test
    @DisplayName("x != y over {1,2,3} is satisfiable with distinct in-domain values")
    void endToEndSatisfiable() {
        CSPModel model = model(List.of(Variable.of("x", 1, 2, 3), Variable.of("y", 1, 2, 3)), hard("c1", "x != y"));

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.SATISFIABLE);
        assertThat(result.getSolution()).containsOnlyKeys("x", "y");
        assertThat(result.getSolution().get("x")).isIn(1, 2, 3).isNotEqualTo(result.getSolution().get("y"));
        assertThat(result.getSolution().get("y")).isIn(1, 2, 3);
        assertThat(result.getSolveTimeMs()).isGreaterThanOrEqualTo(0.0);
        assertThat(result.getMessage()).startsWith("Found solution in");
        assertThat(result.getObjectiveValue()).isNull();
    }

    @Test
    @DisplayName("x != y over {1} is unsatisfiable without a solution")
    void endToEndUnsatisfiable() {
        CSPModel model = model(List.of(Variable.of("x", 1), Variable.of("y", 1)), hard("c1", "x != y"));

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.UNSATISFIABLE);
        assertThat(result.getSolution()).isNull();
        assertThat(result.getMessage()).isEqualTo("No solution exists for this model");
    }

    @Test
    @DisplayName("Named domains decode to their tokens, never to raw indexes")
    void namedDomain() {
        CSPModel model = model(List.of(Variable.of("slot", "Mon_9am", "Mon_2pm")), hard("c1", "slot == 1"));

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.SATISFIABLE);
        assertThat(result.getSolution()).containsEntry("slot", "Mon_2pm");
    }

    @Test
    @DisplayName("A disabled constraint that would make the model unsatisfiable is ignored")
    void disabledConstraintExcluded() {
        CSPModel model = model(List.of(Variable.of("x", 1), Variable.of("y", 1)),
            Constraint.builder().id("c1").expression("x != y").enabled(false).build());

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.SATISFIABLE);
        assertThat(result.getSolution()).containsEntry("x", 1).containsEntry("y", 1);
    }

    @Test
    @DisplayName("Soft constraints are enforced like hard ones")
    void softConstraintsAreHard() {
        CSPModel model = model(List.of(Variable.of("x", 1, 2)),
            hard("c1", "x == 1"),
            Constraint.builder().id("pref").expression("x == 2").type(ConstraintType.SOFT).weight(0.2).build());

        assertThat(solverService.solve(model, 30, false).getStatus()).isEqualTo(SolveStatus.UNSATISFIABLE);
    }

    @Test
    @DisplayName("An unsupported operator surfaces as an error result naming expression and constraint")
    void unsupportedOperatorSurfacesAsError() {
        CSPModel model = model(List.of(Variable.of("x", 1, 2, 3), Variable.of("y", 1, 2, 3)), hard("mod1", "x % y == 1"));

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.ERROR);
        assertThat(result.getSolution()).isNull();
        assertThat(result.getSolveTimeMs()).isZero();
        assertThat(result.getMessage())
            .startsWith("Solver error: ")
            .contains("mod1")
            .contains("x % y == 1")
            .contains("unsupported operator '%'");
    }

    @Test
    @DisplayName("An empty domain never reaches the solver")
    void emptyDomainNeverReachesSolver() {
        SolverBackend backend = mock(SolverBackend.class);
        SolverService service = new SolverService(assembler, backend, new SolutionDecoder(), properties);
        CSPModel model = model(List.of(Variable.builder().name("x").domain(List.of()).build()), hard("c1", "x > 0"));

        SolveResult result = service.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.ERROR);
        assertThat(result.getMessage()).contains("empty domain");
        verify(backend, never()).solve(any(), any());
    }

    @Test
    @DisplayName("An undecided search is reported as a timeout, not as unsatisfiable")
    void unknownVerdictIsTimeout() {
        SolverBackend backend = mock(SolverBackend.class);
        when(backend.solve(any(AssembledModel.class), eq(5))).thenReturn(SolverOutcome.unknown());
        SolverService service = new SolverService(assembler, backend, new SolutionDecoder(), properties);
        CSPModel model = model(List.of(Variable.of("x", 1, 2)), hard("c1", "x > 0"));

        SolveResult result = service.solve(model, 5, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.TIMEOUT);
        assertThat(result.getSolution()).isNull();
        assertThat(result.getMessage()).contains("5s");
    }

    @Test
    @DisplayName("Solver failures are caught and reported with elapsed time zero")
    void solverFailureIsCaught() {
        SolverBackend backend = mock(SolverBackend.class);
        when(backend.solve(any(), any())).thenThrow(new SolverException("Choco solver failed: boom"));
        SolverService service = new SolverService(assembler, backend, new SolutionDecoder(), properties);
        CSPModel model = model(List.of(Variable.of("x", 1, 2)), hard("c1", "x > 0"));

        SolveResult result = service.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.ERROR);
        assertThat(result.getSolveTimeMs()).isZero();
        assertThat(result.getMessage()).isEqualTo("Solver error: Choco solver failed: boom");
    }

    @Test
    @DisplayName("A missing timeout falls back to the configured default")
    void defaultTimeout() {
        SolverBackend backend = mock(SolverBackend.class);
        when(backend.solve(any(), any())).thenReturn(SolverOutcome.unsatisfiable());
        properties.getSolver().setDefaultTimeout(12);
        SolverService service = new SolverService(assembler, backend, new SolutionDecoder(), properties);

        service.solve(model(List.of(Variable.of("x", 1)), hard("c1", "x > 1")), null, false);

        verify(backend).solve(any(AssembledModel.class), eq(12));
    }

    @Test
    @DisplayName("find_all does not change the shape of the result")
    void findAllReturnsSingleSolution() {
        CSPModel model = model(List.of(Variable.of("x", 1, 2, 3)), hard("c1", "x >= 1"));

        SolveResult result = solverService.solve(model, 30, true);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.SATISFIABLE);
        assertThat(result.getSolution()).containsOnlyKeys("x");
    }

    @Test
    @DisplayName("A proven optimum is classified as optimal with its objective value")
    void optimal() {
        CSPModel model = model(List.of(Variable.of("x", 1, 2, 3), Variable.of("y", 1, 2, 3)), hard("c1", "x != y"));
        model.setObjective(Objective.builder().sense(ObjectiveSense.MINIMIZE).expression("x + y").build());

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.getObjectiveValue()).isEqualTo(3.0);
        assertThat(result.getSolution()).containsOnlyKeys("x", "y");
        assertThat(result.getMessage()).startsWith("Found optimal solution");
    }

    @Test
    @DisplayName("A pathologically nested expression is an error result, not a crash")
    void deeplyNestedExpressionIsError() {
        String nested = "(".repeat(50000) + "x == 1" + ")".repeat(50000);
        CSPModel model = model(List.of(Variable.of("x", 1, 2)), hard("deep", nested));

        SolveResult result = solverService.solve(model, 30, false);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.ERROR);
        assertThat(result.getMessage()).contains("deep").contains("expression is too long");
    }

    @Test
    @DisplayName("Boolean domains are indexed in declared order, not read as 0/1")
    void booleanDomainsAreIndexed() {
        SolveResult declaredTrueFirst = solverService.solve(
            model(List.of(Variable.of("b", true, false)), hard("c1", "b == 1")), 30, false);
        SolveResult declaredFalseFirst = solverService.solve(
            model(List.of(Variable.of("b", false, true)), hard("c1", "b == 1")), 30, false);

        assertThat(declaredTrueFirst.getSolution()).containsEntry("b", false);
        assertThat(declaredFalseFirst.getSolution()).containsEntry("b", true);
    }
}
