package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.CheckType;
import com.vigil.checkmodel.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link CheckType} to the executor that runs it.
 */
public final class ExecutorRegistry {

    private final Map<CheckType, CheckExecutor> executors = new EnumMap<>(CheckType.class);

    public ExecutorRegistry(Collection<? extends CheckExecutor> executors) {
        for (CheckExecutor executor : executors) {
            register(executor);
        }
    }

    /**
     * Registers an executor under its type, replacing any previous one.
     */
    public void register(CheckExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        executors.put(executor.type(), executor);
    }

    /**
     * @throws ConfigurationException if no executor handles {@code type}
     */
    public CheckExecutor forType(CheckType type) {
        CheckExecutor executor = executors.get(type);
        if (executor == null) {
            throw new ConfigurationException("No executor registered for check type " + type.value());
        }
        return executor;
    }

    /**
     * Verifies that every definition can be executed, before anything runs.
     *
     * @throws ConfigurationException listing every uncovered check
     */
    public void requireCoverage(CheckDefinitionSet definitions) {
        List<String> errors = new ArrayList<>();
        for (CheckDefinition definition : definitions.all()) {
            if (!executors.containsKey(definition.type())) {
                errors.add("no executor for check '" + definition.id() + "' of type " + definition.type().value());
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    public int size() {
        return executors.size();
    }
}
