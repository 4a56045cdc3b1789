package org.xcos.csp.output;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SolveStatus {
    SATISFIABLE("satisfiable"),
    UNSATISFIABLE("unsatisfiable"),
    OPTIMAL("optimal"),
    TIMEOUT("timeout"),
    ERROR("error");

    private final String value;

    SolveStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Only these outcomes carry a solution.
     */
    public boolean hasSolution() {
        return this == SATISFIABLE || this == OPTIMAL;
    }
}
