package com.vigil.resultstore;

import com.vigil.checkmodel.PendingEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * Persisted claims of two-cycle checks, kept next to the results they correlate.
 * <p>
 * The ledger is append-only too: opening a claim and resolving it are two separate records, and
 * the outstanding claim of a check is found by walking its partitions from the newest back.
 */
public interface PendingLedger {

    /**
     * Records a newly opened claim.
     *
     * @throws StorageException if the record cannot be appended
     */
    void open(PendingEntry entry);

    /**
     * Records that the claim identified by {@code token} is closed.
     *
     * @param outcome short label of how it closed ("completed", "failed", "expired", ...)
     * @throws StorageException if the record cannot be appended
     */
    void resolve(String checkId, String token, Instant resolvedAt, String outcome);

    /**
     * Returns the most recent claim of {@code checkId} that has not been resolved.
     *
     * @param now reference time that decides which partitions are scanned
     * @throws StorageException if a partition cannot be read
     */
    Optional<PendingEntry> findOutstanding(String checkId, Instant now);
}
