package com.vigil.aggregation.transition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Edges of the overall status that are worth a notification. */
public enum TransitionKind {

    /** Overall status left {@code up}. */
    INCIDENT("incident"),

    /** Overall status returned to {@code up}. */
    RECOVERED("recovered");

    private final String value;

    TransitionKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TransitionKind fromValue(String value) {
        for (TransitionKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown transition kind: " + value);
    }
}
