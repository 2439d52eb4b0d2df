package com.vigil.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Window summary of one check, in the shape the status page renders.
 *
 * @param currentStatus    status of the latest sample, or nodata
 * @param latestTimestamp  time of the latest sample
 * @param windowUptimePct  uptime over every sample in the window
 * @param days             one entry per day of the window, oldest first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckSummary(
        String id,
        String name,
        String description,
        String note,
        String planTier,
        BucketStatus currentStatus,
        Instant latestTimestamp,
        long latestResponseMs,
        String latestMessage,
        Double windowUptimePct,
        List<DailySummary> days) {

    public CheckSummary {
        days = days == null ? List.of() : List.copyOf(days);
    }
}
