package org.xcos.csp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ObjectiveSense {
    MINIMIZE("minimize"),
    MAXIMIZE("maximize");

    private final String value;

    ObjectiveSense(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ObjectiveSense fromValue(String value) {
        for (ObjectiveSense sense : values()) {
            if (sense.value.equalsIgnoreCase(value)) {
                return sense;
            }
        }
        throw new IllegalArgumentException("Unknown objective sense: " + value);
    }
}
