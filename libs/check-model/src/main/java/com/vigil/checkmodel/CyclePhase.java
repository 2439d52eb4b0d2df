package com.vigil.checkmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of a two-cycle check that produced a result.
 */
public enum CyclePhase {

    /** The side-effecting action (upload, trigger) that opens a pending claim. */
    START("start"),

    /** The poll, one invocation later, that observes whether the side effect completed. */
    VERIFY("verify");

    private final String value;

    CyclePhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CyclePhase fromValue(String value) {
        for (CyclePhase phase : values()) {
            if (phase.value.equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown cycle phase: " + value);
    }
}
