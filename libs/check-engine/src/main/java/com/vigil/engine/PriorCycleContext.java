package com.vigil.engine;

import com.vigil.checkmodel.CheckResult;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Everything an executor needs to know about the invocation it runs in.
 *
 * @param runId           id of the current invocation, for logs and spans
 * @param now             invocation time shared by every check of the run
 * @param gate            same-cycle verdict on the check's dependency
 * @param requestTimeout  default per-request timeout, overridable by the {@code timeout} param
 * @param defaultInterval interval used when a definition does not declare one
 * @param recorder        persists a phase result as soon as the phase has finished
 */
public record PriorCycleContext(String runId, Instant now, DependencyGate gate,
                                Duration requestTimeout, Duration defaultInterval,
                                Consumer<CheckResult> recorder) {

    public PriorCycleContext {
        if (now == null) {
            throw new IllegalArgumentException("now must not be null");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (defaultInterval == null || defaultInterval.isZero() || defaultInterval.isNegative()) {
            throw new IllegalArgumentException("defaultInterval must be positive");
        }
        gate = gate == null ? DependencyGate.none() : gate;
        recorder = recorder == null ? result -> { } : recorder;
    }

    /** A context whose phase results are only returned, not recorded early. */
    public PriorCycleContext(String runId, Instant now, DependencyGate gate,
                             Duration requestTimeout, Duration defaultInterval) {
        this(runId, now, gate, requestTimeout, defaultInterval, null);
    }

    /** Whether the executor must fail fast without touching the network. */
    public boolean dependencyFailed() {
        return gate.failed();
    }

    /** Returns a copy with a different gate. */
    public PriorCycleContext withGate(DependencyGate newGate) {
        return new PriorCycleContext(runId, now, newGate, requestTimeout, defaultInterval, recorder);
    }

    /** Returns a copy that hands finished phase results to {@code newRecorder}. */
    public PriorCycleContext withRecorder(Consumer<CheckResult> newRecorder) {
        return new PriorCycleContext(runId, now, gate, requestTimeout, defaultInterval, newRecorder);
    }
}
