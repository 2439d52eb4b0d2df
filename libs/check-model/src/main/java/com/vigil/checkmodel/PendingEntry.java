package com.vigil.checkmodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Claim that a two-cycle check initiated an asynchronous side effect which must be observed as
 * completed before {@code deadline}.
 *
 * @param checkId    check that opened the claim
 * @param token      opaque correlation token, copied to both phases' results
 * @param createdAt  when the {@code start} action succeeded
 * @param deadline   after this instant an unobserved completion counts as failure
 * @param attributes side-effect references needed by {@code verify} (document id, batch id, ...)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PendingEntry(
        @JsonProperty("check_id") String checkId,
        @JsonProperty("token") String token,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("deadline") Instant deadline,
        @JsonProperty("attributes") Map<String, String> attributes) {

    public PendingEntry {
        if (checkId == null || checkId.isBlank()) {
            throw new IllegalArgumentException("checkId must not be null or blank");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must not be null or blank");
        }
        if (createdAt == null || deadline == null) {
            throw new IllegalArgumentException("createdAt and deadline must not be null");
        }
        if (deadline.isBefore(createdAt)) {
            throw new IllegalArgumentException("deadline must not be before createdAt");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /** Whether the claim can no longer succeed at {@code now}. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }

    /** Time elapsed since the claim was opened. */
    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /** Returns an attribute or null. */
    public String attribute(String key) {
        return attributes.get(key);
    }
}
