package com.vigil.aggregation;

import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;

/**
 * Running counts over the samples of one bucket.
 */
final class BucketTally {

    private int total;
    private int down;
    private int degraded;
    private long responseSum;
    private int responseCount;

    void add(CheckResult sample) {
        total++;
        if (sample.status() == CheckStatus.DOWN) {
            down++;
        } else if (sample.status() == CheckStatus.DEGRADED) {
            degraded++;
        }
        if (sample.hasResponseTime()) {
            responseSum += sample.responseTimeMs();
            responseCount++;
        }
    }

    void addAll(BucketTally other) {
        total += other.total;
        down += other.down;
        degraded += other.degraded;
        responseSum += other.responseSum;
        responseCount += other.responseCount;
    }

    BucketStatus status() {
        return BucketClassifier.classify(total, down, degraded);
    }

    Double uptimePct() {
        return BucketClassifier.uptimePct(total, down);
    }

    /** Mean latency of samples that measured one, or -1. */
    long avgResponseMs() {
        return responseCount == 0 ? CheckResult.NOT_MEASURED : Math.round((double) responseSum / responseCount);
    }

    int total() {
        return total;
    }
}
