package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for executors. Applies dependency fail-fast before any subclass code runs and
 * turns a missing parameter or secret into a {@code down} result for that check alone.
 */
public abstract class AbstractCheckExecutor implements CheckExecutor {

    private static final Logger log = LoggerFactory.getLogger(AbstractCheckExecutor.class);

    protected final ProbeClient client;
    private final SecretResolver secrets;
    private final SensitiveDataRedactor redactor;

    protected AbstractCheckExecutor(ProbeClient client, SecretResolver secrets, SensitiveDataRedactor redactor) {
        if (client == null || secrets == null || redactor == null) {
            throw new IllegalArgumentException("client, secrets and redactor must not be null");
        }
        this.client = client;
        this.secrets = secrets;
        this.redactor = redactor;
    }

    @Override
    public final CheckOutcome execute(CheckDefinition definition, PriorCycleContext context) {
        if (definition.type() != type()) {
            throw new IllegalArgumentException("Executor for " + type().value()
                    + " cannot run check '" + definition.id() + "' of type " + definition.type().value());
        }
        if (context.dependencyFailed()) {
            log.info("Skipping probe: {}", context.gate().message());
            return CheckOutcome.of(CheckResult.of(definition.id(), context.now(), CheckStatus.DOWN,
                    CheckResult.NOT_MEASURED, context.gate().message()));
        }

        CheckInvocation invocation = new CheckInvocation(definition, context, secrets, redactor);
        try {
            return probe(invocation);
        } catch (ConfigurationException e) {
            String message = invocation.scrub(e.getMessage());
            log.error("Check '{}' is misconfigured: {}", definition.id(), message);
            return CheckOutcome.of(invocation.result(CheckStatus.DOWN, CheckResult.NOT_MEASURED, message));
        }
    }

    /** Runs the probe. Only called when the dependency gate passed. */
    protected abstract CheckOutcome probe(CheckInvocation invocation);
}
