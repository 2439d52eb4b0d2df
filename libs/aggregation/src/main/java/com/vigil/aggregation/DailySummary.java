package com.vigil.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.List;

/**
 * One UTC day of one check. The status is classified over the day's hourly statuses; uptime,
 * latency and the sample count are computed over the day's raw samples.
 *
 * @param hours the 24 hourly buckets, or empty when the day has no samples
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DailySummary(LocalDate date, BucketStatus status, int sampleCount, Double uptimePct,
                           long avgResponseMs, List<HourlyBucket> hours) {

    public DailySummary {
        hours = hours == null ? List.of() : List.copyOf(hours);
    }
}
