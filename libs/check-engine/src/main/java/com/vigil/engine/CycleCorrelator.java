package com.vigil.engine;

import com.vigil.checkmodel.PendingEntry;
import com.vigil.resultstore.PendingLedger;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks the {@code start}/{@code verify} claims of two-cycle checks across invocations.
 * <p>
 * State per check is {@code idle -> pending -> resolved}, persisted in a {@link PendingLedger}.
 * A claim expires {@code deadlineMultiplier} intervals after it was opened. At most one claim per
 * check is outstanding: {@link #open} refuses a second one.
 */
public class CycleCorrelator {

    public static final int DEFAULT_DEADLINE_MULTIPLIER = 3;

    private final PendingLedger ledger;
    private final int deadlineMultiplier;

    public CycleCorrelator(PendingLedger ledger) {
        this(ledger, DEFAULT_DEADLINE_MULTIPLIER);
    }

    public CycleCorrelator(PendingLedger ledger, int deadlineMultiplier) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        if (deadlineMultiplier < 1) {
            throw new IllegalArgumentException("deadlineMultiplier must be >= 1, was " + deadlineMultiplier);
        }
        this.ledger = ledger;
        this.deadlineMultiplier = deadlineMultiplier;
    }

    /** The unresolved claim of {@code checkId}, if any. */
    public Optional<PendingEntry> outstanding(String checkId, Instant now) {
        return ledger.findOutstanding(checkId, now);
    }

    /**
     * Opens a claim after a successful {@code start}.
     *
     * @throws IllegalStateException if the check already has an outstanding claim
     */
    public PendingEntry open(String checkId, String token, Instant createdAt, Duration interval,
                             Map<String, String> attributes) {
        Optional<PendingEntry> existing = ledger.findOutstanding(checkId, createdAt);
        if (existing.isPresent()) {
            throw new IllegalStateException("Check '" + checkId + "' already has outstanding claim "
                    + existing.get().token());
        }
        PendingEntry entry = new PendingEntry(checkId, token, createdAt, deadlineFor(createdAt, interval), attributes);
        ledger.open(entry);
        return entry;
    }

    /** Closes a claim. {@code outcome} is a short label: completed, failed, expired. */
    public void resolve(PendingEntry entry, Instant resolvedAt, String outcome) {
        ledger.resolve(entry.checkId(), entry.token(), resolvedAt, outcome);
    }

    public Instant deadlineFor(Instant createdAt, Duration interval) {
        return createdAt.plus(interval.multipliedBy(deadlineMultiplier));
    }

    public int deadlineMultiplier() {
        return deadlineMultiplier;
    }

    /** A fresh opaque token. */
    public static String newToken() {
        return UUID.randomUUID().toString();
    }
}
