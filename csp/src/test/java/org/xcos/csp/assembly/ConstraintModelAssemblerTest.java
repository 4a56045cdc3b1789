package org.xcos.csp.assembly;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.xcos.csp.encoding.DomainEncoder;
import org.xcos.csp.exceptions.DomainException;
import org.xcos.csp.exceptions.ModelAssemblyException;
import org.xcos.csp.exceptions.UnknownVariableException;
import org.xcos.csp.expression.ExpressionCompiler;
import org.xcos.csp.expression.ir.ValueType;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.model.Constraint;
import org.xcos.csp.model.ConstraintType;
import org.xcos.csp.model.Objective;
import org.xcos.csp.model.ObjectiveSense;
import org.xcos.csp.model.Variable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintModelAssemblerTest {

    private ConstraintModelAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ConstraintModelAssembler(new DomainEncoder(), new ExpressionCompiler());
    }

    private static CSPModel model(List<Constraint> constraints) {
        return CSPModel.builder()
            .id("m1")
            .name("Test")
            .variables(List.of(Variable.of("x", 1, 2, 3), Variable.of("y", 1, 2, 3)))
            .constraints(constraints)
            .build();
    }

    @Test
    @DisplayName("Enabled constraints are compiled in declaration order")
    void compilesEnabledConstraintsInOrder() {
        AssembledModel assembled = assembler.assemble(model(List.of(
            Constraint.builder().id("c1").expression("x != y").build(),
            Constraint.builder().id("c2").expression("x + y <= 4").build())));

        assertThat(assembled.getVariables()).containsOnlyKeys("x", "y");
        assertThat(assembled.getConstraints()).extracting(CompiledConstraint::getId).containsExactly("c1", "c2");
        assertThat(assembled.hasObjective()).isFalse();
    }

    @Test
    @DisplayName("Disabled constraints are skipped, even when they would not compile")
    void skipsDisabledConstraints() {
        AssembledModel assembled = assembler.assemble(model(List.of(
            Constraint.builder().id("c1").expression("x != y").build(),
            Constraint.builder().id("off").expression("undeclared % 2").enabled(false).build())));

        assertThat(assembled.getConstraints()).extracting(CompiledConstraint::getId).containsExactly("c1");
    }

    @Test
    @DisplayName("Soft constraints are submitted like hard ones")
    void softConstraintsAreKept() {
        AssembledModel assembled = assembler.assemble(model(List.of(
            Constraint.builder().id("pref").expression("x > 1").type(ConstraintType.SOFT).weight(0.5).build())));

        assertThat(assembled.getConstraints()).singleElement()
            .satisfies(c -> assertThat(c.getType()).isEqualTo(ConstraintType.SOFT));
    }

    @Test
    @DisplayName("A failing constraint aborts the whole assembly, naming its id and expression")
    void failingConstraintAbortsAssembly() {
        CSPModel model = model(List.of(
            Constraint.builder().id("c1").expression("x != y").build(),
            Constraint.builder().id("c2").expression("z != y").build()));

        assertThatThrownBy(() -> assembler.assemble(model))
            .isInstanceOf(ModelAssemblyException.class)
            .hasMessageContaining("c2")
            .hasMessageContaining("z != y")
            .hasCauseInstanceOf(UnknownVariableException.class);
    }

    @Test
    @DisplayName("Domain errors propagate before any constraint is compiled")
    void domainErrorsPropagate() {
        CSPModel model = CSPModel.builder()
            .id("m1")
            .name("Test")
            .variables(List.of(Variable.builder().name("x").domain(List.of()).build()))
            .constraints(List.of(Constraint.builder().id("c1").expression("x > 0").build()))
            .build();

        assertThatThrownBy(() -> assembler.assemble(model)).isInstanceOf(DomainException.class);
    }

    @Test
    @DisplayName("The objective is compiled with its sense")
    void compilesObjective() {
        CSPModel model = model(List.of());
        model.setObjective(Objective.builder().sense(ObjectiveSense.MAXIMIZE).expression("x + y").build());

        AssembledModel assembled = assembler.assemble(model);

        assertThat(assembled.hasObjective()).isTrue();
        assertThat(assembled.getObjective().getType()).isEqualTo(ValueType.INTEGER);
        assertThat(assembled.getObjectiveSense()).isEqualTo(ObjectiveSense.MAXIMIZE);
    }

    @Test
    @DisplayName("A broken objective aborts the assembly")
    void brokenObjectiveAbortsAssembly() {
        CSPModel model = model(List.of());
        model.setObjective(Objective.builder().expression("x +").build());

        assertThatThrownBy(() -> assembler.assemble(model))
            .isInstanceOf(ModelAssemblyException.class)
            .hasMessageContaining("objective");
    }
}
