package com.vigil.engine.executor;

import com.vigil.engine.CheckExecutor;
import com.vigil.engine.CycleCorrelator;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.observability.SensitiveDataRedactor;

import java.util.List;

/**
 * The executors of every built-in check type.
 */
public final class CheckExecutors {

    private CheckExecutors() {
    }

    public static List<CheckExecutor> standard(ProbeClient client, SecretResolver secrets, CycleCorrelator correlator) {
        SensitiveDataRedactor redactor = new SensitiveDataRedactor();
        return List.of(
                new HttpCheckExecutor(client, secrets, redactor),
                new RetrieveCheckExecutor(client, secrets, redactor),
                new KnowledgeCheckExecutor(client, secrets, redactor, correlator),
                new WebhookCheckExecutor(client, secrets, redactor, correlator));
    }
}
