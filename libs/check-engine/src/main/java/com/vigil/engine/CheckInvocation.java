package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.checkmodel.CyclePhase;
import com.vigil.observability.SensitiveDataRedactor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One execution of one check. Remembers every secret it hands out so that result messages can
 * be scrubbed before they are persisted.
 */
public final class CheckInvocation {

    private final CheckDefinition definition;
    private final PriorCycleContext context;
    private final SecretResolver secrets;
    private final SensitiveDataRedactor redactor;
    private final List<String> resolvedSecrets = new ArrayList<>();

    CheckInvocation(CheckDefinition definition, PriorCycleContext context,
                    SecretResolver secrets, SensitiveDataRedactor redactor) {
        this.definition = definition;
        this.context = context;
        this.secrets = secrets;
        this.redactor = redactor;
    }

    public CheckDefinition definition() {
        return definition;
    }

    public PriorCycleContext context() {
        return context;
    }

    public String checkId() {
        return definition.id();
    }

    public Instant now() {
        return context.now();
    }

    /** The check's interval, or the engine default. */
    public Duration interval() {
        return definition.intervalOr(context.defaultInterval());
    }

    /** Per-request timeout: the {@code timeout} param in seconds, or the engine default. */
    public Duration requestTimeout() {
        int seconds = definition.intParam("timeout", 0);
        return seconds > 0 ? Duration.ofSeconds(seconds) : context.requestTimeout();
    }

    /**
     * Resolves the secret named by the parameter {@code paramKey}.
     *
     * @throws ConfigurationException if the parameter or the environment variable is missing
     */
    public String secret(String paramKey) {
        String variable = definition.requireParam(paramKey);
        String value = secrets.resolve(variable).orElseThrow(() -> new ConfigurationException(
                "Environment variable " + variable + " (" + paramKey + ") is not set"));
        resolvedSecrets.add(value);
        return value;
    }

    /**
     * Resolves the secret named by {@code paramKey} when the parameter is configured and the
     * variable is set; empty otherwise.
     */
    public Optional<String> optionalSecret(String paramKey) {
        Optional<String> value = definition.param(paramKey).flatMap(secrets::resolve);
        value.ifPresent(resolvedSecrets::add);
        return value;
    }

    /** Removes every secret handed out so far, and bearer tokens, from {@code text}. */
    public String scrub(String text) {
        return redactor.scrub(text, resolvedSecrets);
    }

    /**
     * Hands a finished phase result to the run so it is persisted even if a later phase of this
     * execution never returns. The same result must still be part of the returned outcome.
     */
    public void record(CheckResult result) {
        context.recorder().accept(result);
    }

    public CheckResult result(CheckStatus status, long responseTimeMs, String message) {
        return CheckResult.of(checkId(), now(), status, responseTimeMs, scrub(message));
    }

    public CheckResult phased(CheckStatus status, long responseTimeMs, String message,
                              String token, CyclePhase phase) {
        return CheckResult.phased(checkId(), now(), status, responseTimeMs, scrub(message), token, phase);
    }
}
