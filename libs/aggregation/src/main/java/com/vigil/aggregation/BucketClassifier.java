package com.vigil.aggregation;

/**
 * Classification rule shared by every bucket size.
 * <p>
 * Over {@code total} definite statuses of which {@code downCount} are down:
 * no samples is {@code nodata}; no down sample is {@code up}, or {@code degraded} when any sample
 * is degraded; a down share of at least one half is {@code down}; anything else is
 * {@code degraded}. Increasing {@code downCount} at a fixed total never improves the result.
 */
public final class BucketClassifier {

    /** Down share at or above which a bucket is down. */
    public static final double DOWN_THRESHOLD = 0.5;

    private BucketClassifier() {
    }

    public static BucketStatus classify(int total, int downCount, int degradedCount) {
        if (total < 0 || downCount < 0 || degradedCount < 0 || downCount + degradedCount > total) {
            throw new IllegalArgumentException("invalid counts: total=" + total
                    + ", down=" + downCount + ", degraded=" + degradedCount);
        }
        if (total == 0) {
            return BucketStatus.NODATA;
        }
        if (downCount == 0) {
            return degradedCount > 0 ? BucketStatus.DEGRADED : BucketStatus.UP;
        }
        if ((double) downCount / total >= DOWN_THRESHOLD) {
            return BucketStatus.DOWN;
        }
        return BucketStatus.DEGRADED;
    }

    /**
     * {@code (total - downCount) / total * 100}, rounded to one decimal; null when
     * {@code total == 0}.
     */
    public static Double uptimePct(int total, int downCount) {
        if (total == 0) {
            return null;
        }
        double pct = (total - downCount) * 100.0 / total;
        return Math.round(pct * 10.0) / 10.0;
    }
}
