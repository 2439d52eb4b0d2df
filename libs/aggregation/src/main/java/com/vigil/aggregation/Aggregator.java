package com.vigil.aggregation;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.CheckResult;
import com.vigil.resultstore.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link StatusSummary} of a retention window from raw results.
 * <p>
 * Nothing is maintained incrementally: every call reads the whole window back from the
 * {@link ResultStore}, so the summary always agrees with the records on disk. Successful
 * {@code start} records of two-cycle checks are bookkeeping and are not counted.
 */
public class Aggregator {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    public static final int DEFAULT_WINDOW_DAYS = 90;
    static final int HOURS_PER_DAY = 24;

    private final ResultStore store;
    private final int windowDays;
    private final Clock clock;

    public Aggregator(ResultStore store, int windowDays, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1, was " + windowDays);
        }
        this.store = store;
        this.windowDays = windowDays;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Summarizes the window ending today (UTC).
     *
     * @throws com.vigil.resultstore.StorageException if any partition of the window is unreadable
     */
    public StatusSummary summarize(CheckDefinitionSet definitions) {
        Instant generatedAt = clock.instant();
        LocalDate today = LocalDate.ofInstant(generatedAt, ZoneOffset.UTC);
        List<LocalDate> dates = new ArrayList<>(windowDays);
        for (int back = windowDays - 1; back >= 0; back--) {
            dates.add(today.minusDays(back));
        }
        Instant from = dates.get(0).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<CheckSummary> checks = new ArrayList<>();
        for (CheckDefinition definition : definitions.all()) {
            checks.add(summarizeCheck(definition, dates, from, to));
        }

        List<OverallDay> overallDays = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            int day = i;
            overallDays.add(new OverallDay(dates.get(i), BucketStatus.overall(
                    checks.stream().map(c -> c.days().get(day).status()).toList())));
        }

        BucketStatus current = BucketStatus.overall(checks.stream().map(CheckSummary::currentStatus).toList());
        Instant lastChecked = checks.stream()
                .map(CheckSummary::latestTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        log.info("Aggregated {} checks over {} days, overall {}", checks.size(), windowDays, current.value());
        return new StatusSummary(StatusSummary.label(current), current, lastChecked, generatedAt,
                dates, overallDays, checks);
    }

    private CheckSummary summarizeCheck(CheckDefinition definition, List<LocalDate> dates, Instant from, Instant to) {
        List<CheckResult> samples = store.readRange(definition.id(), from, to).stream()
                .filter(CheckResult::isSample)
                .toList();

        Map<LocalDate, BucketTally[]> byDay = new HashMap<>();
        BucketTally window = new BucketTally();
        for (CheckResult sample : samples) {
            ZonedDateTime at = sample.timestamp().atZone(ZoneOffset.UTC);
            BucketTally[] hours = byDay.computeIfAbsent(at.toLocalDate(), d -> newDay());
            hours[at.getHour()].add(sample);
            window.add(sample);
        }

        List<DailySummary> days = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            BucketTally[] hours = byDay.get(date);
            days.add(hours == null ? emptyDay(date) : summarizeDay(date, hours));
        }

        CheckResult latest = samples.isEmpty() ? null : samples.get(samples.size() - 1);
        return new CheckSummary(
                definition.id(),
                definition.name(),
                definition.description(),
                definition.note(),
                definition.planTier(),
                latest == null ? BucketStatus.NODATA : BucketStatus.of(latest.status()),
                latest == null ? null : latest.timestamp(),
                latest == null ? CheckResult.NOT_MEASURED : latest.responseTimeMs(),
                latest == null ? "" : latest.message(),
                window.uptimePct(),
                days);
    }

    static DailySummary summarizeDay(LocalDate date, BucketTally[] hours) {
        BucketTally day = new BucketTally();
        List<HourlyBucket> buckets = new ArrayList<>(HOURS_PER_DAY);
        int hoursWithData = 0;
        int hoursDown = 0;
        int hoursDegraded = 0;
        for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
            BucketTally tally = hours[hour];
            BucketStatus status = tally.status();
            buckets.add(new HourlyBucket(hour, status, tally.total(), tally.uptimePct(), tally.avgResponseMs()));
            day.addAll(tally);
            if (status != BucketStatus.NODATA) {
                hoursWithData++;
            }
            if (status == BucketStatus.DOWN) {
                hoursDown++;
            } else if (status == BucketStatus.DEGRADED) {
                hoursDegraded++;
            }
        }
        BucketStatus status = BucketClassifier.classify(hoursWithData, hoursDown, hoursDegraded);
        return new DailySummary(date, status, day.total(), day.uptimePct(), day.avgResponseMs(), buckets);
    }

    private static DailySummary emptyDay(LocalDate date) {
        return new DailySummary(date, BucketStatus.NODATA, 0, null, CheckResult.NOT_MEASURED, List.of());
    }

    static BucketTally[] newDay() {
        BucketTally[] hours = new BucketTally[HOURS_PER_DAY];
        for (int i = 0; i < HOURS_PER_DAY; i++) {
            hours[i] = new BucketTally();
        }
        return hours;
    }

    public int windowDays() {
        return windowDays;
    }
}
