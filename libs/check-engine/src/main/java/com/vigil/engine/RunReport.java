package com.vigil.engine;

import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summary of one invocation of the {@link CheckRunner}.
 *
 * @param runId      invocation id, also present in logs and spans
 * @param startedAt  invocation time shared by all checks
 * @param finishedAt when the last outcome was persisted
 * @param outcomes   per-check outcomes in configuration order
 */
public record RunReport(String runId, Instant startedAt, Instant finishedAt, Map<String, CheckOutcome> outcomes) {

    public RunReport {
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    /** All results appended during the run. */
    public List<CheckResult> results() {
        return outcomes.values().stream().flatMap(o -> o.results().stream()).toList();
    }

    public Optional<CheckStatus> statusOf(String checkId) {
        CheckOutcome outcome = outcomes.get(checkId);
        return outcome == null ? Optional.empty() : outcome.cycleStatus();
    }

    /** Ids of checks that produced nothing this cycle. */
    public List<String> skipped() {
        return outcomes.values().stream().filter(CheckOutcome::isSkipped).map(CheckOutcome::checkId).toList();
    }
}
