package com.vigil.engine;

import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * What one check produced in one invocation: zero, one or two results.
 * <p>
 * Two-phase checks may emit a {@code verify} result followed by the next {@code start}; a check
 * waiting on an unresolved claim emits nothing and carries a {@code skipReason} instead.
 *
 * @param checkId    the check
 * @param results    results to append, in order
 * @param skipReason why no result was produced, or null
 */
public record CheckOutcome(String checkId, List<CheckResult> results, String skipReason) {

    public CheckOutcome {
        if (checkId == null || checkId.isBlank()) {
            throw new IllegalArgumentException("checkId must not be null or blank");
        }
        results = results == null ? List.of() : List.copyOf(results);
        for (CheckResult result : results) {
            if (!checkId.equals(result.checkId())) {
                throw new IllegalArgumentException(
                        "result of check '" + result.checkId() + "' in outcome of '" + checkId + "'");
            }
        }
    }

    public static CheckOutcome of(CheckResult result) {
        return new CheckOutcome(result.checkId(), List.of(result), null);
    }

    public static CheckOutcome of(String checkId, List<CheckResult> results) {
        return new CheckOutcome(checkId, results, null);
    }

    /** An outcome with no result this cycle. */
    public static CheckOutcome skipped(String checkId, String reason) {
        return new CheckOutcome(checkId, List.of(), reason);
    }

    /**
     * The status dependents see: the worst status among this cycle's results, or empty when
     * nothing was produced.
     */
    public Optional<CheckStatus> cycleStatus() {
        return results.stream()
                .map(CheckResult::status)
                .max(Comparator.naturalOrder());
    }

    public boolean isSkipped() {
        return results.isEmpty();
    }
}
