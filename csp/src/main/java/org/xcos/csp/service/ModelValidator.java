package org.xcos.csp.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;
import org.xcos.csp.exceptions.InvalidModelException;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.model.Constraint;
import org.xcos.csp.model.ConstraintType;
import org.xcos.csp.model.Variable;

/**
 * Structural checks run before a model is stored. Domains and expressions are not
 * compiled here; those errors belong to solving.
 */
@Component
public class ModelValidator {

    public void validate(CSPModel model) {
        List<String> errors = new ArrayList<>();

        if (isBlank(model.getId())) {
            errors.add("Model id is required");
        }
        if (isBlank(model.getName())) {
            errors.add("Model name is required");
        }

        Set<String> variableNames = new HashSet<>();
        for (Variable variable : nullSafe(model.getVariables())) {
            if (variable == null) {
                errors.add("Variable entry is null");
                continue;
            }
            if (isBlank(variable.getName())) {
                errors.add("Every variable needs a name");
            } else if (!variableNames.add(variable.getName())) {
                errors.add("Duplicate variable name: " + variable.getName());
            }
            if (variable.getDomain() == null) {
                errors.add("Variable " + variable.getName() + " has no domain");
            }
        }

        Set<String> constraintIds = new HashSet<>();
        for (Constraint constraint : nullSafe(model.getConstraints())) {
            if (constraint == null) {
                errors.add("Constraint entry is null");
                continue;
            }
            String id = constraint.getId();
            if (isBlank(id)) {
                errors.add("Every constraint needs an id");
            } else if (!constraintIds.add(id)) {
                errors.add("Duplicate constraint id: " + id);
            }
            if (isBlank(constraint.getExpression())) {
                errors.add("Constraint " + id + " has no expression");
            }
            if (constraint.getType() == null) {
                errors.add("Constraint " + id + " has no type");
            }
            Double weight = constraint.getWeight();
            if (weight != null) {
                if (constraint.getType() != ConstraintType.SOFT) {
                    errors.add("Constraint " + id + " has a weight but is not soft");
                } else if (weight < 0.0 || weight > 1.0) {
                    errors.add("Constraint " + id + " weight must be within [0, 1] but is " + weight);
                }
            }
        }

        if (model.getObjective() != null && isBlank(model.getObjective().getExpression())) {
            errors.add("Objective has no expression");
        }

        if (!errors.isEmpty()) {
            throw new InvalidModelException(errors);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
