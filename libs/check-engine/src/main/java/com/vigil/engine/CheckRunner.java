package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.CyclePhase;
import com.vigil.observability.EngineMetrics;
import com.vigil.observability.RunContext;
import com.vigil.observability.RunContextHolder;
import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.observability.SpanHelper;
import com.vigil.resultstore.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes every configured check once and appends the results.
 * <p>
 * One call to {@link #run} is one invocation: all checks share its timestamp, independent checks
 * run in parallel on a pool sized to the check count, and each check executes inside its own
 * span and MDC context. A {@link com.vigil.resultstore.StorageException} aborts the invocation;
 * results appended before it remain valid.
 */
public class CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    static final String SPAN_NAME = "check.execute";

    private final ExecutorRegistry registry;
    private final ResultStore store;
    private final EngineMetrics metrics;
    private final SpanHelper spans;
    private final EngineSettings settings;
    private final Clock clock;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public CheckRunner(ExecutorRegistry registry, ResultStore store, EngineMetrics metrics,
                       SpanHelper spans, EngineSettings settings, Clock clock) {
        if (registry == null || store == null || metrics == null || spans == null) {
            throw new IllegalArgumentException("registry, store, metrics and spans must not be null");
        }
        this.registry = registry;
        this.store = store;
        this.metrics = metrics;
        this.spans = spans;
        this.settings = settings == null ? EngineSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Runs all checks of {@code definitions} once.
     *
     * @throws com.vigil.checkmodel.ConfigurationException if a check type has no executor
     * @throws com.vigil.resultstore.StorageException     if a result or claim cannot be persisted
     */
    public RunReport run(CheckDefinitionSet definitions) {
        registry.requireCoverage(definitions);

        String runId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        RunContext runContext = RunContext.forRun(runId);
        PriorCycleContext base = new PriorCycleContext(runId, now, DependencyGate.none(),
                settings.checkTimeout(), settings.defaultInterval());

        int threads = settings.maxParallelism() > 0
                ? Math.min(settings.maxParallelism(), definitions.size())
                : definitions.size();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, threads), workerThreads());
        try {
            return RunContextHolder.callWithContext(runContext, () -> {
                log.info("Starting run with {} checks on {} workers", definitions.size(), threads);
                DependencyScheduler scheduler = new DependencyScheduler(pool, settings::executionBound);
                RunnerTask task = new RunnerTask(runContext, base);
                Map<String, CheckOutcome> outcomes = scheduler.schedule(definitions, task, task::persist);
                RunReport report = new RunReport(runId, now, clock.instant(), outcomes);
                log.info("Run finished: {} results, {} checks without a sample",
                        report.results().size(), report.skipped().size());
                return report;
            });
        } finally {
            pool.shutdownNow();
        }
    }

    private void append(CheckResult result) {
        store.append(result);
        log.info("{} {} {}ms {}", result.checkId(), result.status().value(),
                result.responseTimeMs(), result.message());
    }

    /**
     * Results one check recorded while it was still running. Closed when the check timed out or
     * crashed, after which further phases of that execution are dropped.
     */
    private final class PhaseJournal {

        private final List<CheckResult> recorded = new ArrayList<>();
        private boolean closed;

        synchronized void record(CheckResult result) {
            if (closed) {
                log.warn("Dropping late {} result of check '{}'", phaseOf(result), result.checkId());
                return;
            }
            append(result);
            recorded.add(result);
        }

        synchronized List<CheckResult> close() {
            closed = true;
            return List.copyOf(recorded);
        }

        synchronized boolean contains(CheckResult result) {
            return recorded.stream().anyMatch(kept -> kept == result);
        }
    }

    private final class RunnerTask implements DependencyScheduler.CheckTask {

        private final RunContext runContext;
        private final PriorCycleContext base;
        private final Map<String, PhaseJournal> journals = new ConcurrentHashMap<>();

        RunnerTask(RunContext runContext, PriorCycleContext base) {
            this.runContext = runContext;
            this.base = base;
        }

        private PhaseJournal journal(String checkId) {
            return journals.computeIfAbsent(checkId, id -> new PhaseJournal());
        }

        @Override
        public CheckOutcome execute(CheckDefinition definition, DependencyGate gate) {
            PriorCycleContext context = base.withGate(gate).withRecorder(journal(definition.id())::record);
            return RunContextHolder.callWithContext(runContext.withCheck(definition.id()), () ->
                    spans.withSpan(SPAN_NAME, Map.of("check.type", definition.type().value()), () -> {
                        log.debug("Executing {} check with params {}", definition.type().value(),
                                redactor.redact(definition.params()));
                        long started = System.nanoTime();
                        CheckOutcome outcome = registry.forType(definition.type()).execute(definition, context);
                        record(definition, gate, outcome, Duration.ofNanos(System.nanoTime() - started));
                        return outcome;
                    }));
        }

        @Override
        public CheckOutcome fallback(CheckDefinition definition, DependencyGate gate, Throwable cause) {
            return RunContextHolder.callWithContext(runContext.withCheck(definition.id()), () -> {
                Duration bound = settings.executionBound(definition);
                List<CheckResult> finished = journal(definition.id()).close();
                String message = cause instanceof TimeoutException
                        ? "Timed out after " + describe(bound)
                        : "Execution error: " + redactor.scrub(String.valueOf(cause.getMessage()), List.of());
                CheckOutcome outcome = CheckOutcome.of(definition.id(), fallbackResults(definition, finished, message));
                record(definition, gate, outcome, bound);
                return outcome;
            });
        }

        /**
         * Keeps every phase that finished. A verify without its start is followed by a failed
         * start; an execution that recorded nothing gets a single failed result.
         */
        private List<CheckResult> fallbackResults(CheckDefinition definition, List<CheckResult> finished,
                                                  String message) {
            if (finished.isEmpty()) {
                return List.of(CheckResult.of(definition.id(), base.now(), CheckStatus.DOWN,
                        CheckResult.NOT_MEASURED, message));
            }
            boolean verifyOnly = finished.stream().allMatch(result -> result.cyclePhase() == CyclePhase.VERIFY);
            if (!verifyOnly) {
                return finished;
            }
            List<CheckResult> results = new ArrayList<>(finished);
            results.add(CheckResult.phased(definition.id(), base.now(), CheckStatus.DOWN,
                    CheckResult.NOT_MEASURED, message, null, CyclePhase.START));
            return results;
        }

        /** Appends what the check did not already record while running. */
        void persist(CheckOutcome outcome) {
            PhaseJournal journal = journal(outcome.checkId());
            for (CheckResult result : outcome.results()) {
                if (!journal.contains(result)) {
                    append(result);
                }
            }
        }

        private void record(CheckDefinition definition, DependencyGate gate, CheckOutcome outcome, Duration elapsed) {
            if (gate.failed()) {
                metrics.recordSkipped(definition.id(), "dependency");
            }
            if (outcome.isSkipped()) {
                metrics.recordSkipped(definition.id(), "pending");
                log.info("No sample this cycle: {}", outcome.skipReason());
                return;
            }
            for (CheckResult result : outcome.results()) {
                metrics.recordExecution(definition.id(), definition.type().value(), result.status().value(), elapsed);
            }
        }
    }

    private static String phaseOf(CheckResult result) {
        return result.cyclePhase() == null ? "single" : result.cyclePhase().value();
    }

    static String describe(Duration bound) {
        return bound.toMillis() % 1000 == 0 ? bound.toSeconds() + "s" : bound.toMillis() + "ms";
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "vigil-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
