package org.xcos.csp.service;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.xcos.csp.exceptions.InvalidModelException;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.model.Constraint;
import org.xcos.csp.model.ConstraintType;
import org.xcos.csp.model.Objective;
import org.xcos.csp.model.Variable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ModelValidatorTest {

    private final ModelValidator validator = new ModelValidator();

    private static CSPModel.CSPModelBuilder valid() {
        return CSPModel.builder()
            .id("m1")
            .name("Valid")
            .variables(List.of(Variable.of("x", 1, 2)))
            .constraints(List.of(Constraint.builder().id("c1").expression("x > 1").build()));
    }

    private List<String> errorsOf(CSPModel model) {
        InvalidModelException e = catchThrowableOfType(() -> validator.validate(model), InvalidModelException.class);
        assertThat(e).isNotNull();
        return e.getErrors();
    }

    @Test
    void acceptsValidModel() {
        assertThatCode(() -> validator.validate(valid().build())).doesNotThrowAnyException();
    }

    @Test
    void acceptsWeightedSoftConstraint() {
        CSPModel model = valid()
            .constraints(List.of(Constraint.builder().id("c1").expression("x > 1")
                .type(ConstraintType.SOFT).weight(0.5).build()))
            .build();

        assertThatCode(() -> validator.validate(model)).doesNotThrowAnyException();
    }

    @Test
    void requiresIdAndName() {
        assertThat(errorsOf(valid().id(" ").name(null).build()))
            .containsExactly("Model id is required", "Model name is required");
    }

    @Test
    void rejectsDuplicateNamesAndIds() {
        CSPModel model = valid()
            .variables(List.of(Variable.of("x", 1), Variable.of("x", 2)))
            .constraints(List.of(
                Constraint.builder().id("c1").expression("x > 0").build(),
                Constraint.builder().id("c1").expression("x < 3").build()))
            .build();

        assertThat(errorsOf(model)).containsExactly("Duplicate variable name: x", "Duplicate constraint id: c1");
    }

    @Test
    void rejectsMissingDomainAndExpression() {
        CSPModel model = valid()
            .variables(List.of(Variable.builder().name("x").build()))
            .constraints(List.of(Constraint.builder().id("c1").expression("").build()))
            .build();

        assertThat(errorsOf(model)).containsExactly("Variable x has no domain", "Constraint c1 has no expression");
    }

    @Test
    void rejectsWeightOnHardConstraint() {
        CSPModel model = valid()
            .constraints(List.of(Constraint.builder().id("c1").expression("x > 1").weight(0.3).build()))
            .build();

        assertThat(errorsOf(model)).containsExactly("Constraint c1 has a weight but is not soft");
    }

    @Test
    void rejectsWeightOutsideUnitInterval() {
        CSPModel model = valid()
            .constraints(List.of(Constraint.builder().id("c1").expression("x > 1")
                .type(ConstraintType.SOFT).weight(1.5).build()))
            .build();

        assertThat(errorsOf(model)).singleElement().asString().contains("within [0, 1]");
    }

    @Test
    void rejectsBlankObjective() {
        CSPModel model = valid().objective(Objective.builder().expression(" ").build()).build();

        assertThat(errorsOf(model)).containsExactly("Objective has no expression");
    }

    @Test
    void rejectsNullEntries() {
        CSPModel model = valid()
            .variables(Arrays.asList(Variable.of("x", 1), null))
            .constraints(Arrays.asList((Constraint) null))
            .build();

        assertThat(errorsOf(model)).containsExactly("Variable entry is null", "Constraint entry is null");
    }
}
