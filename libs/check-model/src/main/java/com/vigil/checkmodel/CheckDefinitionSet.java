package com.vigil.checkmodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The validated, immutable set of checks loaded once per process.
 *
 * <p>Construction via {@link #of(List)} rejects duplicate ids, dangling or self
 * {@code depends_on} references, dependency cycles, and definitions missing the parameters
 * their {@link CheckType} requires. All problems are reported at once.
 */
public final class CheckDefinitionSet {

    private final Map<String, CheckDefinition> byId;

    private CheckDefinitionSet(Map<String, CheckDefinition> byId) {
        this.byId = Collections.unmodifiableMap(byId);
    }

    /**
     * Validates and wraps the given definitions, preserving their order.
     *
     * @throws ConfigurationException if any definition is invalid
     */
    public static CheckDefinitionSet of(List<CheckDefinition> definitions) {
        validate(definitions).throwIfInvalid();
        Map<String, CheckDefinition> byId = new LinkedHashMap<>();
        for (CheckDefinition definition : definitions) {
            byId.put(definition.id(), definition);
        }
        return new CheckDefinitionSet(byId);
    }

    /**
     * Validates definitions without constructing a set.
     */
    public static ValidationResult validate(List<CheckDefinition> definitions) {
        var errors = new ArrayList<String>();
        if (definitions == null || definitions.isEmpty()) {
            errors.add("at least one check must be configured");
            return ValidationResult.fail(errors);
        }

        Map<String, CheckDefinition> byId = new LinkedHashMap<>();
        for (CheckDefinition definition : definitions) {
            if (definition == null) {
                errors.add("check definition must not be null");
                continue;
            }
            if (isBlank(definition.id())) {
                errors.add("check id must not be null or blank");
                continue;
            }
            if (byId.putIfAbsent(definition.id(), definition) != null) {
                errors.add("duplicate check id '" + definition.id() + "'");
            }
            if (isBlank(definition.name())) {
                errors.add("check '" + definition.id() + "' must have a name");
            }
            if (definition.type() == null) {
                errors.add("check '" + definition.id() + "' has no type");
            } else {
                for (String param : definition.type().requiredParams()) {
                    if (definition.param(param).isEmpty()) {
                        errors.add("check '" + definition.id() + "' of type "
                                + definition.type().value() + " is missing parameter '" + param + "'");
                    }
                }
            }
        }

        for (CheckDefinition definition : byId.values()) {
            if (!definition.hasDependency()) {
                continue;
            }
            if (definition.dependsOn().equals(definition.id())) {
                errors.add("check '" + definition.id() + "' depends on itself");
            } else if (!byId.containsKey(definition.dependsOn())) {
                errors.add("check '" + definition.id() + "' depends on unknown check '"
                        + definition.dependsOn() + "'");
            }
        }

        if (errors.isEmpty()) {
            findCycle(byId).ifPresent(cycle ->
                    errors.add("dependency cycle: " + String.join(" -> ", cycle)));
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Walks each depends_on chain; a chain that revisits a check on the current path is a cycle.
     */
    private static Optional<List<String>> findCycle(Map<String, CheckDefinition> byId) {
        Set<String> cleared = new HashSet<>();
        for (String start : byId.keySet()) {
            List<String> path = new ArrayList<>();
            Map<String, Integer> onPath = new HashMap<>();
            String current = start;
            while (current != null && !cleared.contains(current)) {
                Integer seenAt = onPath.putIfAbsent(current, path.size());
                if (seenAt != null) {
                    List<String> cycle = new ArrayList<>(path.subList(seenAt, path.size()));
                    cycle.add(current);
                    return Optional.of(cycle);
                }
                path.add(current);
                current = byId.get(current).dependsOn();
            }
            cleared.addAll(path);
        }
        return Optional.empty();
    }

    /** All definitions in configuration order. */
    public List<CheckDefinition> all() {
        return List.copyOf(byId.values());
    }

    /** Looks up a definition by id. */
    public Optional<CheckDefinition> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Definitions that declare {@code depends_on = id}, in configuration order. */
    public List<CheckDefinition> dependentsOf(String id) {
        return byId.values().stream()
                .filter(d -> id.equals(d.dependsOn()))
                .toList();
    }

    /** Check ids in configuration order. */
    public List<String> ids() {
        return List.copyOf(byId.keySet());
    }

    public int size() {
        return byId.size();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
