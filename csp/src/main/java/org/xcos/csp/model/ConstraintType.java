package org.xcos.csp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hard constraints must hold; soft constraints are preferences (currently posted as hard).
 */
public enum ConstraintType {
    HARD("hard"),
    SOFT("soft");

    private final String value;

    ConstraintType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConstraintType fromValue(String value) {
        for (ConstraintType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown constraint type: " + value);
    }
}
