package com.vigil.checkmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome classification of a single probe.
 */
public enum CheckStatus {

    /** The probed service behaved as expected. */
    UP("up"),

    /** The service responded but not fully as expected. */
    DEGRADED("degraded"),

    /** The probe failed: transport error, timeout, mismatch, or dependency failure. */
    DOWN("down");

    private final String value;

    CheckStatus(String value) {
        this.value = value;
    }

    /** Lower-case wire value ("up", "degraded", "down"). */
    @JsonValue
    public String value() {
        return value;
    }

    /** {@code true} for {@link #DOWN} and {@link #DEGRADED}. */
    public boolean isUnhealthy() {
        return this != UP;
    }

    /**
     * Parses a wire value.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    @JsonCreator
    public static CheckStatus fromValue(String value) {
        for (CheckStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown check status: " + value);
    }
}
