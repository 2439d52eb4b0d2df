package com.vigil.observability;

/**
 * Identifies the invocation and check a thread is currently working for.
 * <p>
 * Placed into SLF4J MDC by {@link RunContextHolder} so that every log line written while a
 * check executes carries the run id, the check id and, for two-cycle checks, the phase.
 *
 * @param runId   unique id of the batch invocation
 * @param checkId check being executed (nullable outside check execution)
 * @param phase   cycle phase being executed (nullable for single-phase checks)
 */
public record RunContext(String runId, String checkId, String phase) {

    /** MDC key for the invocation id. */
    public static final String MDC_RUN_ID = "runId";

    /** MDC key for the check id. */
    public static final String MDC_CHECK_ID = "checkId";

    /** MDC key for the cycle phase. */
    public static final String MDC_PHASE = "phase";

    public RunContext {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be null or blank");
        }
    }

    /** Context for invocation-level work. */
    public static RunContext forRun(String runId) {
        return new RunContext(runId, null, null);
    }

    /** Same run, narrowed to one check. */
    public RunContext withCheck(String checkId) {
        return new RunContext(runId, checkId, null);
    }

    /** Same run and check, narrowed to one phase. */
    public RunContext withPhase(String phase) {
        return new RunContext(runId, checkId, phase);
    }
}
