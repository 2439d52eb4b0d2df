package com.vigil.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the status page needs, recomputed from raw history on every aggregation.
 *
 * @param currentOverall       display label of {@code currentOverallStatus}
 * @param currentOverallStatus worst-of the checks' current statuses, nodata excluded
 * @param lastChecked          latest sample time across all checks
 * @param generatedAt          when this summary was computed
 * @param dates                the window's days, oldest first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusSummary(
        String currentOverall,
        BucketStatus currentOverallStatus,
        Instant lastChecked,
        Instant generatedAt,
        List<LocalDate> dates,
        List<OverallDay> overallDays,
        List<CheckSummary> checks) {

    public StatusSummary {
        dates = dates == null ? List.of() : List.copyOf(dates);
        overallDays = overallDays == null ? List.of() : List.copyOf(overallDays);
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    /** Ids of checks whose current status is down or degraded, in configuration order. */
    @JsonIgnore
    public List<String> unhealthyChecks() {
        return checks.stream().filter(c -> c.currentStatus().isUnhealthy()).map(CheckSummary::id).toList();
    }

    /** Display label of an overall status. */
    public static String label(BucketStatus status) {
        return switch (status) {
            case UP -> "All Components Operational";
            case DOWN -> "Partial Outage";
            case DEGRADED -> "Degraded Performance";
            case NODATA -> "No Data";
        };
    }
}
