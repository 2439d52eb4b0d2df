package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.resultstore.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a set of checks in dependency order within one invocation.
 * <p>
 * Checks without a dependency start immediately and in parallel. A dependent check waits for its
 * dependency's outcome of the same cycle and receives a {@link DependencyGate}; the dependency
 * counts as failed when it is down, produced nothing, timed out or crashed. Depth is unbounded.
 * <p>
 * Each execution is bounded, measured from the moment a worker picks the check up: when the bound
 * elapses the worker is interrupted and the check is recorded through {@link CheckTask#fallback},
 * so a late result is never persisted. Time spent queued behind other checks does not count.
 */
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    /**
     * The work the scheduler orchestrates for one check.
     */
    public interface CheckTask {

        /** Executes the check with the given dependency verdict. */
        CheckOutcome execute(CheckDefinition definition, DependencyGate gate);

        /**
         * Outcome recorded when {@link #execute} timed out or crashed. On timeout it is called
         * before the worker is interrupted, so it can stop accepting results first.
         */
        CheckOutcome fallback(CheckDefinition definition, DependencyGate gate, Throwable cause);
    }

    private final ExecutorService pool;
    private final Function<CheckDefinition, Duration> executionBounds;

    /** A scheduler that gives every check the same bound. */
    public DependencyScheduler(ExecutorService pool, Duration executionBound) {
        this(pool, requirePositive(executionBound));
    }

    /** A scheduler that asks {@code executionBounds} for the bound of each check. */
    public DependencyScheduler(ExecutorService pool, Function<CheckDefinition, Duration> executionBounds) {
        if (pool == null) {
            throw new IllegalArgumentException("pool must not be null");
        }
        if (executionBounds == null) {
            throw new IllegalArgumentException("executionBounds must not be null");
        }
        this.pool = pool;
        this.executionBounds = executionBounds;
    }

    private static Function<CheckDefinition, Duration> requirePositive(Duration executionBound) {
        if (executionBound == null || executionBound.isZero() || executionBound.isNegative()) {
            throw new IllegalArgumentException("executionBound must be positive");
        }
        return definition -> executionBound;
    }

    /**
     * Runs every definition and hands each outcome to {@code sink} as soon as it is final.
     *
     * @return outcomes keyed by check id, in configuration order
     * @throws StorageException if the sink or an executor could not persist
     */
    public Map<String, CheckOutcome> schedule(CheckDefinitionSet definitions, CheckTask task,
                                              Consumer<CheckOutcome> sink) {
        Map<String, CompletableFuture<CheckOutcome>> futures = new LinkedHashMap<>();
        for (CheckDefinition definition : definitions.all()) {
            futureFor(definition, definitions, futures, task, sink);
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        Map<String, CheckOutcome> outcomes = new LinkedHashMap<>();
        for (CheckDefinition definition : definitions.all()) {
            outcomes.put(definition.id(), futures.get(definition.id()).join());
        }
        return outcomes;
    }

    private CompletableFuture<CheckOutcome> futureFor(CheckDefinition definition, CheckDefinitionSet definitions,
                                                      Map<String, CompletableFuture<CheckOutcome>> futures,
                                                      CheckTask task, Consumer<CheckOutcome> sink) {
        CompletableFuture<CheckOutcome> existing = futures.get(definition.id());
        if (existing != null) {
            return existing;
        }

        CompletableFuture<DependencyGate> gate;
        if (!definition.hasDependency()) {
            gate = CompletableFuture.completedFuture(DependencyGate.none());
        } else {
            CheckDefinition dependency = definitions.get(definition.dependsOn()).orElseThrow(() ->
                    new ConfigurationException("Check '" + definition.id() + "' depends on unknown check '"
                            + definition.dependsOn() + "'"));
            gate = futureFor(dependency, definitions, futures, task, sink)
                    .handle((outcome, error) -> gateFor(dependency.id(), outcome, error));
        }

        CompletableFuture<CheckOutcome> future = gate
                .thenCompose(verdict -> bounded(definition, verdict, task))
                .thenApply(outcome -> {
                    sink.accept(outcome);
                    return outcome;
                });
        futures.put(definition.id(), future);
        return future;
    }

    private CompletableFuture<CheckOutcome> bounded(CheckDefinition definition, DependencyGate gate, CheckTask task) {
        Duration bound = executionBounds.apply(definition);
        CompletableFuture<CheckOutcome> result = new CompletableFuture<>();
        Future<?> running = pool.submit(() -> {
            result.orTimeout(bound.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(task.execute(definition, gate));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });

        return result.handle((outcome, error) -> {
            if (error == null) {
                return outcome;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                log.warn("Check '{}' exceeded {}ms and is interrupted", definition.id(), bound.toMillis());
                try {
                    return task.fallback(definition, gate, cause);
                } finally {
                    running.cancel(true);
                }
            }
            if (cause instanceof StorageException storage) {
                throw storage;
            }
            log.error("Check '{}' failed unexpectedly", definition.id(), cause);
            return task.fallback(definition, gate, cause);
        });
    }

    static DependencyGate gateFor(String dependencyId, CheckOutcome outcome, Throwable error) {
        if (error != null || outcome == null) {
            return DependencyGate.failed(dependencyId, "has no result this cycle");
        }
        Optional<CheckStatus> status = outcome.cycleStatus();
        if (status.isEmpty()) {
            return DependencyGate.failed(dependencyId, "has no result this cycle");
        }
        if (status.get() == CheckStatus.DOWN) {
            return DependencyGate.failed(dependencyId, "is down");
        }
        return DependencyGate.passed(dependencyId);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
