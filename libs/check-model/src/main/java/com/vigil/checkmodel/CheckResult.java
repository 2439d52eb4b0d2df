package com.vigil.checkmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Outcome of one probe, as written to the result store. Immutable once written.
 *
 * <p>Timestamps are truncated to whole seconds (UTC). A {@code responseTimeMs} of
 * {@link #NOT_MEASURED} means no latency was observed (timeout, transport error, fail-fast).
 *
 * @param checkId        id of the check that produced this result
 * @param timestamp      observation time, second precision
 * @param status         up, degraded or down
 * @param responseTimeMs latency in milliseconds, or -1
 * @param message        short human-readable explanation (e.g. "HTTP 200")
 * @param pendingToken   correlates the two phases of a two-cycle check; null otherwise
 * @param cyclePhase     phase that produced this result for two-cycle checks; null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckResult(
        @JsonProperty("check_id") String checkId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("status") CheckStatus status,
        @JsonProperty("response_time_ms") long responseTimeMs,
        @JsonProperty("message") String message,
        @JsonProperty("pending_token") String pendingToken,
        @JsonProperty("cycle_phase") CyclePhase cyclePhase) {

    /** Sentinel for "latency not measured". */
    public static final long NOT_MEASURED = -1;

    public CheckResult {
        if (checkId == null || checkId.isBlank()) {
            throw new IllegalArgumentException("checkId must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (responseTimeMs < NOT_MEASURED) {
            throw new IllegalArgumentException("responseTimeMs must be >= 0 or -1, was " + responseTimeMs);
        }
        timestamp = timestamp.truncatedTo(ChronoUnit.SECONDS);
        message = message == null ? "" : message;
    }

    /** Creates a single-phase result. */
    public static CheckResult of(String checkId, Instant timestamp, CheckStatus status,
                                 long responseTimeMs, String message) {
        return new CheckResult(checkId, timestamp, status, responseTimeMs, message, null, null);
    }

    /** Creates a result belonging to one phase of a two-cycle check. */
    public static CheckResult phased(String checkId, Instant timestamp, CheckStatus status,
                                     long responseTimeMs, String message,
                                     String pendingToken, CyclePhase phase) {
        return new CheckResult(checkId, timestamp, status, responseTimeMs, message, pendingToken, phase);
    }

    /**
     * Whether this record counts toward uptime. A successful {@code start} only opens a claim;
     * the matching {@code verify} is the sample. A failed start is a sample.
     */
    @JsonIgnore
    public boolean isSample() {
        return !(cyclePhase == CyclePhase.START && status == CheckStatus.UP);
    }

    /** Whether a latency was observed. */
    @JsonIgnore
    public boolean hasResponseTime() {
        return responseTimeMs >= 0;
    }
}
