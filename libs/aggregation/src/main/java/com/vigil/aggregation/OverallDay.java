package com.vigil.aggregation;

import java.time.LocalDate;

/** Worst-of status across all checks for one day. */
public record OverallDay(LocalDate date, BucketStatus status) {
}
