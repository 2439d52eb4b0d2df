package com.vigil.engine;

/**
 * Verdict on a check's dependency for the current cycle.
 *
 * @param dependencyId id of the dependency, or null when the check has none
 * @param failed       whether the dependency's same-cycle outcome is down or indeterminate
 * @param reason       short explanation used in the fail-fast result message
 */
public record DependencyGate(String dependencyId, boolean failed, String reason) {

    private static final DependencyGate NONE = new DependencyGate(null, false, "");

    public DependencyGate {
        reason = reason == null ? "" : reason;
    }

    /** Gate of a check without dependency. */
    public static DependencyGate none() {
        return NONE;
    }

    public static DependencyGate passed(String dependencyId) {
        return new DependencyGate(dependencyId, false, "");
    }

    public static DependencyGate failed(String dependencyId, String reason) {
        return new DependencyGate(dependencyId, true, reason);
    }

    /** Message recorded on the fail-fast result. */
    public String message() {
        return "Dependency '" + dependencyId + "' " + reason;
    }
}
