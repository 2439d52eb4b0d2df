package com.vigil.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One UTC hour of one check.
 *
 * @param hour          hour of day, 0 to 23
 * @param status        classified status
 * @param sampleCount   samples in the hour
 * @param uptimePct     absent when there are no samples
 * @param avgResponseMs mean measured latency, or -1
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HourlyBucket(int hour, BucketStatus status, int sampleCount, Double uptimePct, long avgResponseMs) {
}
