package com.vigil.aggregation.transition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A detected edge of the overall status.
 *
 * @param kind           incident or recovered
 * @param affectedChecks checks now unhealthy (incident) or no longer unhealthy (recovered)
 * @param timestamp      when the edge was detected
 * @param dedupKey       identical for every re-delivery of the same edge
 */
public record TransitionEvent(
        @JsonProperty("kind") TransitionKind kind,
        @JsonProperty("affected_checks") List<String> affectedChecks,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("dedup_key") String dedupKey) {

    public TransitionEvent {
        if (kind == null || timestamp == null || dedupKey == null || dedupKey.isBlank()) {
            throw new IllegalArgumentException("kind, timestamp and dedupKey are required");
        }
        affectedChecks = affectedChecks == null ? List.of() : List.copyOf(affectedChecks);
    }
}
