package com.vigil.aggregation.transition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.aggregation.BucketStatus;

import java.time.Instant;
import java.util.List;

/**
 * Last overall status the detector acted on. Read and written once per invocation.
 *
 * @param overallStatus   overall status at {@code updatedAt}
 * @param unhealthyChecks checks that were down or degraded
 * @param updatedAt       when this state was computed
 */
public record TransitionState(
        @JsonProperty("overall_status") BucketStatus overallStatus,
        @JsonProperty("unhealthy_checks") List<String> unhealthyChecks,
        @JsonProperty("updated_at") Instant updatedAt) {

    public TransitionState {
        if (overallStatus == null || updatedAt == null) {
            throw new IllegalArgumentException("overallStatus and updatedAt are required");
        }
        unhealthyChecks = unhealthyChecks == null ? List.of() : List.copyOf(unhealthyChecks);
    }
}
