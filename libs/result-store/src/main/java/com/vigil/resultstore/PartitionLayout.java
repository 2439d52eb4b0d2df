package com.vigil.resultstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Maps (check, UTC day) pairs to partition files under a data root:
 *
 * <pre>
 * {root}/results/{checkId}/{yyyy}/{MM}/{yyyy-MM-dd}.jsonl
 * {root}/pending/{checkId}/{yyyy-MM-dd}.jsonl
 * </pre>
 */
public final class PartitionLayout {

    private static final Pattern PARTITION_NAME = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})\\.jsonl");
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;

    public PartitionLayout(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        this.root = root;
    }

    /** Result partition of a check for the given UTC day. */
    public Path resultPartition(String checkId, LocalDate day) {
        return root.resolve("results")
                .resolve(safe(checkId))
                .resolve(String.format("%04d", day.getYear()))
                .resolve(String.format("%02d", day.getMonthValue()))
                .resolve(day + ".jsonl");
    }

    /** Pending-claim partition of a check for the given UTC day. */
    public Path pendingPartition(String checkId, LocalDate day) {
        return root.resolve("pending").resolve(safe(checkId)).resolve(day + ".jsonl");
    }

    /**
     * Days that have a pending partition for the check, newest first.
     *
     * @throws StorageException if the check's pending directory cannot be listed
     */
    public List<LocalDate> pendingDays(String checkId) {
        Path directory = root.resolve("pending").resolve(safe(checkId));
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<LocalDate> days = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(file -> PARTITION_NAME.matcher(file.getFileName().toString()))
                    .filter(Matcher::matches)
                    .forEach(name -> days.add(LocalDate.parse(name.group(1))));
        } catch (IOException e) {
            throw new StorageException("Failed to list pending partitions in " + directory, e);
        }
        days.sort(Comparator.reverseOrder());
        return days;
    }

    /** UTC calendar day of an instant. */
    public static LocalDate utcDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public Path root() {
        return root;
    }

    private static String safe(String checkId) {
        if (checkId == null || !SAFE_ID.matcher(checkId).matches()) {
            throw new IllegalArgumentException("check id is not usable as a partition name: " + checkId);
        }
        return checkId;
    }
}
