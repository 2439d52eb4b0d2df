package com.vigil.checkmodel;

import java.util.List;

/**
 * Fatal load-time error: cyclic dependency graph, unknown check type, malformed check
 * parameters. Aborts the invocation before any check runs.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(List<String> errors) {
        super("Invalid check configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /** All problems found, in discovery order. */
    public List<String> errors() {
        return errors;
    }
}
