package com.vigil.resultstore;

import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckResultSerializer;
import com.vigil.checkmodel.CheckResultSerializer.RecordSerializationException;
import com.vigil.checkmodel.PendingEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * File-backed {@link ResultStore} and {@link PendingLedger} writing one JSON object per line.
 * <p>
 * Each append opens its partition with {@code CREATE + APPEND}, writes the complete line in one
 * buffer and closes the file, so a crash can at worst lose the record being written. Appends to
 * the same partition are serialized on a per-partition lock; appends to different partitions
 * proceed in parallel.
 * <p>
 * This is a POJO (no framework annotations); wiring happens in the runner.
 */
public class JsonlResultStore implements ResultStore, PendingLedger {

    private static final Logger log = LoggerFactory.getLogger(JsonlResultStore.class);

    private final PartitionLayout layout;
    private final Map<Path, Object> partitionLocks = new ConcurrentHashMap<>();
    private final Map<Path, Instant> lastTimestamps = new ConcurrentHashMap<>();

    public JsonlResultStore(Path root) {
        this(new PartitionLayout(root));
    }

    public JsonlResultStore(PartitionLayout layout) {
        if (layout == null) {
            throw new IllegalArgumentException("layout must not be null");
        }
        this.layout = layout;
    }

    // ---- ResultStore ----

    @Override
    public void append(CheckResult result) {
        Path partition = layout.resultPartition(result.checkId(), PartitionLayout.utcDay(result.timestamp()));
        String line = CheckResultSerializer.serialize(result);

        synchronized (lockFor(partition)) {
            Instant last = lastTimestamps.computeIfAbsent(partition, this::lastTimestampOnDisk);
            if (last != null && result.timestamp().isBefore(last)) {
                throw new StorageException("Out-of-order append to " + partition + ": "
                        + result.timestamp() + " is before last record " + last);
            }
            appendLine(partition, line);
            lastTimestamps.put(partition, result.timestamp());
        }
        log.debug("Appended {} result for check {} to {}", result.status().value(), result.checkId(), partition);
    }

    @Override
    public List<CheckResult> readRange(String checkId, Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to must not be null");
        }
        List<CheckResult> results = new ArrayList<>();
        if (!from.isBefore(to)) {
            return results;
        }

        LocalDate firstDay = PartitionLayout.utcDay(from);
        LocalDate lastDay = PartitionLayout.utcDay(to.minusNanos(1));
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            Path partition = layout.resultPartition(checkId, day);
            for (CheckResult result : readPartition(partition, CheckResultSerializer::deserialize)) {
                if (!result.timestamp().isBefore(from) && result.timestamp().isBefore(to)) {
                    results.add(result);
                }
            }
        }
        results.sort(Comparator.comparing(CheckResult::timestamp));
        return results;
    }

    // ---- PendingLedger ----

    @Override
    public void open(PendingEntry entry) {
        Path partition = layout.pendingPartition(entry.checkId(), PartitionLayout.utcDay(entry.createdAt()));
        String line = CheckResultSerializer.write(PendingRecord.opened(entry), "pending claim " + entry.token());
        synchronized (lockFor(partition)) {
            appendLine(partition, line);
        }
        log.debug("Opened pending claim {} for check {} (deadline {})",
                entry.token(), entry.checkId(), entry.deadline());
    }

    @Override
    public void resolve(String checkId, String token, Instant resolvedAt, String outcome) {
        Path partition = layout.pendingPartition(checkId, PartitionLayout.utcDay(resolvedAt));
        String line = CheckResultSerializer.write(
                PendingRecord.resolved(checkId, token, resolvedAt, outcome), "pending resolution " + token);
        synchronized (lockFor(partition)) {
            appendLine(partition, line);
        }
        log.debug("Resolved pending claim {} for check {} as {}", token, checkId, outcome);
    }

    /**
     * Walks the check's pending partitions from the newest back. A resolution is always written
     * on or after the day its claim was opened, so it is seen before the claim. The newest opened
     * claim decides: unresolved, it is the outstanding one; resolved, nothing older can be
     * outstanding because a claim is only opened once the previous one was resolved. Partitions
     * dated after {@code now} are ignored.
     */
    @Override
    public Optional<PendingEntry> findOutstanding(String checkId, Instant now) {
        LocalDate today = PartitionLayout.utcDay(now);
        Set<String> resolved = new HashSet<>();

        for (LocalDate day : layout.pendingDays(checkId)) {
            if (day.isAfter(today)) {
                continue;
            }
            List<PendingRecord> records = readPartition(layout.pendingPartition(checkId, day),
                    line -> CheckResultSerializer.read(line, PendingRecord.class));
            for (int i = records.size() - 1; i >= 0; i--) {
                PendingRecord record = records.get(i);
                if (!record.isOpened()) {
                    resolved.add(record.token());
                } else if (resolved.contains(record.token())) {
                    return Optional.empty();
                } else {
                    return Optional.of(record.entry());
                }
            }
        }
        return Optional.empty();
    }

    // ---- file access ----

    private Object lockFor(Path partition) {
        return partitionLocks.computeIfAbsent(partition, p -> new Object());
    }

    private void appendLine(Path partition, String line) {
        byte[] bytes = (line + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(partition.getParent());
            try (FileChannel channel = FileChannel.open(partition,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to append to partition " + partition, e);
        }
    }

    private Instant lastTimestampOnDisk(Path partition) {
        List<CheckResult> existing = readPartition(partition, CheckResultSerializer::deserialize);
        return existing.stream().map(CheckResult::timestamp).max(Comparator.naturalOrder()).orElse(null);
    }

    private <T> List<T> readPartition(Path partition, Function<String, T> parser) {
        List<String> lines;
        try {
            lines = Files.readAllLines(partition, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StorageException("Failed to read partition " + partition, e);
        }

        List<T> records = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(parser.apply(line));
            } catch (RecordSerializationException e) {
                throw new StorageException("Malformed record at " + partition + ":" + (i + 1), e);
            }
        }
        return records;
    }
}
