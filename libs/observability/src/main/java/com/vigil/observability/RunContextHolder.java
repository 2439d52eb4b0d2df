package com.vigil.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link RunContext} with SLF4J MDC bridge.
 * <p>
 * Check executions hop between pool threads, so callers hand the context over explicitly with
 * {@link #callWithContext(RunContext, Supplier)}; the previous context of the worker thread is
 * restored afterwards.
 */
public final class RunContextHolder {

    private static final ThreadLocal<RunContext> CONTEXT = new ThreadLocal<>();

    private RunContextHolder() {
        // Utility class: no instantiation
    }

    /**
     * Sets the run context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RunContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's run context, if set.
     */
    public static Optional<RunContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the run context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(RunContext.MDC_RUN_ID);
        MDC.remove(RunContext.MDC_CHECK_ID);
        MDC.remove(RunContext.MDC_PHASE);
    }

    /**
     * Executes a {@link Supplier} with the given context set, then restores the previous context
     * (or clears if there was none).
     */
    public static <T> T callWithContext(RunContext context, Supplier<T> work) {
        RunContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(RunContext ctx) {
        setMdc(RunContext.MDC_RUN_ID, ctx.runId());
        setMdc(RunContext.MDC_CHECK_ID, ctx.checkId());
        setMdc(RunContext.MDC_PHASE, ctx.phase());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
