package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckType;

/**
 * Runs one kind of probe.
 * <p>
 * Implementations never throw for probe failures: timeouts, transport errors and unexpected
 * responses become {@code down} results. Only {@link com.vigil.resultstore.StorageException}
 * escapes, because a lost pending claim cannot be expressed as a result.
 */
public interface CheckExecutor {

    /** The check type this executor handles. */
    CheckType type();

    /**
     * Executes the check for the current cycle.
     *
     * @param definition the check to run, of {@link #type()}
     * @param context    invocation time, dependency verdict and timeouts
     * @return results to append, possibly none
     */
    CheckOutcome execute(CheckDefinition definition, PriorCycleContext context);
}
