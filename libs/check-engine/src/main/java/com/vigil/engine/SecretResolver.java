package com.vigil.engine;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the secret held by a named environment variable. Check parameters carry only the
 * variable name, never the value.
 */
@FunctionalInterface
public interface SecretResolver {

    /** Returns the non-blank value of {@code name}, or empty. */
    Optional<String> resolve(String name);

    /** Reads the process environment. */
    static SecretResolver environment() {
        return name -> Optional.ofNullable(System.getenv(name)).filter(v -> !v.isBlank());
    }

    /** Fixed values, for tests and embedded use. */
    static SecretResolver of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return name -> Optional.ofNullable(copy.get(name)).filter(v -> !v.isBlank());
    }
}
