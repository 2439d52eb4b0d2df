package com.vigil.resultstore;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.checkmodel.PendingEntry;

import java.time.Instant;

/**
 * One line of a pending-claim partition: either the opening of a claim (carrying the entry) or
 * its resolution (carrying the outcome).
 *
 * @param event   "opened" or "resolved"
 * @param checkId owning check
 * @param token   claim token
 * @param at      when the event happened
 * @param entry   the opened claim; null for resolutions
 * @param outcome how the claim closed; null for openings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingRecord(
        @JsonProperty("event") String event,
        @JsonProperty("check_id") String checkId,
        @JsonProperty("token") String token,
        @JsonProperty("at") Instant at,
        @JsonProperty("entry") PendingEntry entry,
        @JsonProperty("outcome") String outcome) {

    static final String OPENED = "opened";
    static final String RESOLVED = "resolved";

    static PendingRecord opened(PendingEntry entry) {
        return new PendingRecord(OPENED, entry.checkId(), entry.token(), entry.createdAt(), entry, null);
    }

    static PendingRecord resolved(String checkId, String token, Instant at, String outcome) {
        return new PendingRecord(RESOLVED, checkId, token, at, null, outcome);
    }

    @JsonIgnore
    boolean isOpened() {
        return OPENED.equals(event) && entry != null;
    }
}
