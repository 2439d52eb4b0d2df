package com.vigil.resultstore;

import com.vigil.checkmodel.CheckResult;

import java.time.Instant;
import java.util.List;

/**
 * Append-only sink and reader for {@link CheckResult}s, partitioned by check and UTC calendar day.
 * <p>
 * Implementations must be safe under concurrent appends from different checks and must never
 * rewrite or truncate a partition. Missing partitions read as empty; any fault that prevents
 * reading or writing a partition surfaces as a {@link StorageException}.
 */
public interface ResultStore {

    /**
     * Appends one result to its check's partition for the result's UTC day.
     *
     * @throws StorageException if the record cannot be durably appended, or if its timestamp is
     *                          older than the last record already in that partition
     */
    void append(CheckResult result);

    /**
     * Reads all results for a check with {@code from <= timestamp < to}, ordered by timestamp.
     * Records sharing a timestamp keep their append order.
     *
     * @throws StorageException if an existing partition cannot be read or contains a malformed line
     */
    List<CheckResult> readRange(String checkId, Instant from, Instant to);
}
