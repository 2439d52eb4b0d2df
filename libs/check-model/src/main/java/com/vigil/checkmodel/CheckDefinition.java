package com.vigil.checkmodel;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Static, configuration-derived description of one check. Immutable for the process lifetime.
 *
 * @param id          unique identifier, also the storage partition key (e.g. "api")
 * @param name        display name (e.g. "Chat API")
 * @param type        probe kind
 * @param dependsOn   id of the check this one depends on, or null
 * @param description human-readable description passed through to the summary
 * @param note        optional free-form note passed through to the summary
 * @param planTier    optional plan tier label of the monitored service (e.g. "sandbox")
 * @param interval    expected trigger cadence; null means "use the engine default"
 * @param params      type-specific parameters (endpoint, payload, expected substring, ...)
 */
public record CheckDefinition(
        String id,
        String name,
        CheckType type,
        String dependsOn,
        String description,
        String note,
        String planTier,
        Duration interval,
        Map<String, String> params) {

    public CheckDefinition {
        params = params == null ? Map.of() : Map.copyOf(params);
        if (dependsOn != null && dependsOn.isBlank()) {
            dependsOn = null;
        }
        description = description == null ? "" : description;
        note = note == null ? "" : note;
    }

    /** Whether this check is gated on another check's same-cycle result. */
    public boolean hasDependency() {
        return dependsOn != null;
    }

    /** Returns a parameter value if present and non-blank. */
    public Optional<String> param(String key) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /** Returns a parameter value or the given default. */
    public String param(String key, String defaultValue) {
        return param(key).orElse(defaultValue);
    }

    /**
     * Returns a mandatory parameter.
     *
     * @throws ConfigurationException if the parameter is missing or blank
     */
    public String requireParam(String key) {
        return param(key).orElseThrow(() -> new ConfigurationException(
                "Check '" + id + "' is missing required parameter '" + key + "'"));
    }

    /**
     * Returns an integer parameter or the given default.
     *
     * @throws ConfigurationException if the parameter is present but not an integer
     */
    public int intParam(String key, int defaultValue) {
        Optional<String> raw = param(key);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Check '" + id + "' parameter '" + key + "' is not an integer: " + raw.get());
        }
    }

    /** Returns a boolean parameter or the given default. */
    public boolean booleanParam(String key, boolean defaultValue) {
        return param(key).map(v -> Boolean.parseBoolean(v.trim())).orElse(defaultValue);
    }

    /** Returns this check's interval, falling back to the supplied default. */
    public Duration intervalOr(Duration defaultInterval) {
        return interval != null && !interval.isZero() && !interval.isNegative() ? interval : defaultInterval;
    }
}
