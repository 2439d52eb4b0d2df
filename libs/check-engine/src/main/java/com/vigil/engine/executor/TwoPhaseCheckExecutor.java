package com.vigil.engine.executor;

import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.CyclePhase;
import com.vigil.checkmodel.PendingEntry;
import com.vigil.engine.AbstractCheckExecutor;
import com.vigil.engine.CheckInvocation;
import com.vigil.engine.CheckOutcome;
import com.vigil.engine.CycleCorrelator;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.engine.probe.TransportException;
import com.vigil.observability.RunContextHolder;
import com.vigil.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Base class for checks whose side effect completes asynchronously.
 * <p>
 * Each invocation first verifies the outstanding claim, if any:
 * <ul>
 *   <li>completed: {@code up}, response time measured from the claim's creation, claim resolved</li>
 *   <li>failed, or the status could not be fetched: {@code down}, claim resolved</li>
 *   <li>still running before the deadline: no sample, claim kept, no new start</li>
 *   <li>still running at or past the deadline: {@code down}, claim resolved as expired</li>
 * </ul>
 * Once no claim is outstanding, the next {@code start} is issued in the same invocation. Resolved
 * claims are cleaned up through {@link #discard}. Each phase result is recorded through
 * {@link CheckInvocation#record} as soon as it exists, so a verify outlives a start that hangs.
 */
public abstract class TwoPhaseCheckExecutor extends AbstractCheckExecutor {

    private static final Logger log = LoggerFactory.getLogger(TwoPhaseCheckExecutor.class);

    protected final CycleCorrelator correlator;

    protected TwoPhaseCheckExecutor(ProbeClient client, SecretResolver secrets, SensitiveDataRedactor redactor,
                                    CycleCorrelator correlator) {
        super(client, secrets, redactor);
        if (correlator == null) {
            throw new IllegalArgumentException("correlator must not be null");
        }
        this.correlator = correlator;
    }

    /**
     * What the backing system reports for a claim.
     */
    protected record Observation(State state, String message) {

        enum State { COMPLETED, FAILED, IN_PROGRESS }

        static Observation completed(String message) {
            return new Observation(State.COMPLETED, message);
        }

        static Observation failed(String message) {
            return new Observation(State.FAILED, message);
        }

        static Observation inProgress(String message) {
            return new Observation(State.IN_PROGRESS, message);
        }
    }

    /**
     * Result of a {@code start} action.
     *
     * @param succeeded      whether the side effect was initiated
     * @param responseTimeMs latency of the start request, or -1
     * @param message        short explanation
     * @param attributes     references {@link #observe} and {@link #discard} need later
     */
    protected record StartAttempt(boolean succeeded, long responseTimeMs, String message,
                                  Map<String, String> attributes) {

        static StartAttempt succeeded(long responseTimeMs, String message, Map<String, String> attributes) {
            return new StartAttempt(true, responseTimeMs, message, attributes);
        }

        static StartAttempt failed(long responseTimeMs, String message) {
            return new StartAttempt(false, responseTimeMs, message, Map.of());
        }
    }

    /** Initiates the side effect. {@code token} is the claim's correlation token. */
    protected abstract StartAttempt start(CheckInvocation invocation, String token) throws TransportException;

    /** Polls the side effect of {@code entry}. */
    protected abstract Observation observe(CheckInvocation invocation, PendingEntry entry) throws TransportException;

    /** Removes leftovers of a resolved claim. The default does nothing. */
    protected void discard(CheckInvocation invocation, PendingEntry entry) throws TransportException {
    }

    /** Token of a new claim. */
    protected String newToken() {
        return CycleCorrelator.newToken();
    }

    @Override
    protected final CheckOutcome probe(CheckInvocation invocation) {
        String checkId = invocation.checkId();
        List<CheckResult> results = new ArrayList<>();

        Optional<PendingEntry> claim = correlator.outstanding(checkId, invocation.now());
        if (claim.isPresent()) {
            PendingEntry entry = claim.get();
            Duration minimumWait = Duration.ofMinutes(invocation.definition().intParam("min-wait-minutes", 0));
            if (!entry.isExpired(invocation.now()) && entry.age(invocation.now()).compareTo(minimumWait) < 0) {
                return CheckOutcome.skipped(checkId, "claim " + entry.token() + " is younger than " + minimumWait);
            }
            Optional<CheckResult> verified = inPhase(CyclePhase.VERIFY, () -> verify(invocation, entry));
            if (verified.isEmpty()) {
                return CheckOutcome.skipped(checkId, "claim " + entry.token() + " still in progress");
            }
            results.add(verified.get());
        }

        CheckResult started = inPhase(CyclePhase.START, () -> startClaim(invocation));
        invocation.record(started);
        results.add(started);
        return CheckOutcome.of(checkId, results);
    }

    private Optional<CheckResult> verify(CheckInvocation invocation, PendingEntry entry) {
        Observation observation;
        try {
            observation = observe(invocation, entry);
        } catch (TransportException e) {
            observation = Observation.failed("Error checking status: " + e.getMessage());
        }

        CheckResult result;
        String outcome;
        switch (observation.state()) {
            case COMPLETED -> {
                result = invocation.phased(CheckStatus.UP, entry.age(invocation.now()).toMillis(),
                        observation.message(), entry.token(), CyclePhase.VERIFY);
                outcome = "completed";
            }
            case FAILED -> {
                result = invocation.phased(CheckStatus.DOWN, CheckResult.NOT_MEASURED,
                        observation.message(), entry.token(), CyclePhase.VERIFY);
                outcome = "failed";
            }
            default -> {
                if (!entry.isExpired(invocation.now())) {
                    log.info("Claim {} still in progress: {}", entry.token(), invocation.scrub(observation.message()));
                    return Optional.empty();
                }
                result = invocation.phased(CheckStatus.DOWN, CheckResult.NOT_MEASURED,
                        "Not completed before deadline " + entry.deadline() + " (" + observation.message() + ")",
                        entry.token(), CyclePhase.VERIFY);
                outcome = "expired";
            }
        }

        correlator.resolve(entry, invocation.now(), outcome);
        invocation.record(result);
        cleanup(invocation, entry);
        return Optional.of(result);
    }

    private CheckResult startClaim(CheckInvocation invocation) {
        String token = newToken();
        StartAttempt attempt;
        try {
            attempt = start(invocation, token);
        } catch (TransportException e) {
            attempt = StartAttempt.failed(CheckResult.NOT_MEASURED, e.getMessage());
        }

        if (!attempt.succeeded()) {
            return invocation.phased(CheckStatus.DOWN, attempt.responseTimeMs(), attempt.message(),
                    null, CyclePhase.START);
        }
        correlator.open(invocation.checkId(), token, invocation.now(), invocation.interval(), attempt.attributes());
        return invocation.phased(CheckStatus.UP, attempt.responseTimeMs(), attempt.message(), token, CyclePhase.START);
    }

    private void cleanup(CheckInvocation invocation, PendingEntry entry) {
        try {
            discard(invocation, entry);
        } catch (TransportException e) {
            log.warn("Could not clean up claim {}: {}", entry.token(), invocation.scrub(e.getMessage()));
        }
    }

    private static <T> T inPhase(CyclePhase phase, Supplier<T> work) {
        return RunContextHolder.get()
                .map(context -> RunContextHolder.callWithContext(context.withPhase(phase.value()), work))
                .orElseGet(work);
    }
}
