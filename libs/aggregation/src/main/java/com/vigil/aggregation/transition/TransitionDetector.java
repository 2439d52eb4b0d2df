package com.vigil.aggregation.transition;

import com.vigil.aggregation.BucketStatus;
import com.vigil.aggregation.StatusSummary;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Compares the current overall status with the last persisted one and decides whether an
 * incident or a recovery happened. Pure: no I/O, no clock.
 * <p>
 * Only the edges between {@code up} and unhealthy produce events. Moving between {@code down}
 * and {@code degraded} updates the state silently, and a {@code nodata} overall status is
 * ignored entirely so that a gap in data never looks like a recovery.
 */
public final class TransitionDetector {

    /**
     * Result of one comparison.
     *
     * @param event  the event to deliver, if any
     * @param toSave the state to persist after delivery, if any
     */
    public record Detection(Optional<TransitionEvent> event, Optional<TransitionState> toSave) {

        static Detection nothing() {
            return new Detection(Optional.empty(), Optional.empty());
        }

        static Detection saveOnly(TransitionState state) {
            return new Detection(Optional.empty(), Optional.of(state));
        }
    }

    public Detection detect(Optional<TransitionState> previous, StatusSummary summary, Instant now) {
        return detect(previous, summary.currentOverallStatus(), summary.unhealthyChecks(), now);
    }

    public Detection detect(Optional<TransitionState> previous, BucketStatus current,
                            List<String> unhealthyChecks, Instant now) {
        if (current == null || current == BucketStatus.NODATA) {
            return Detection.nothing();
        }
        TransitionState next = new TransitionState(current, unhealthyChecks, now);
        if (previous.isEmpty() || previous.get().overallStatus() == BucketStatus.NODATA) {
            return Detection.saveOnly(next);
        }

        TransitionState prior = previous.get();
        boolean wasUp = prior.overallStatus() == BucketStatus.UP;
        boolean isUp = current == BucketStatus.UP;

        if (wasUp && !isUp) {
            return new Detection(
                    Optional.of(event(TransitionKind.INCIDENT, next.unhealthyChecks(), prior, now)),
                    Optional.of(next));
        }
        if (!wasUp && isUp) {
            return new Detection(
                    Optional.of(event(TransitionKind.RECOVERED, prior.unhealthyChecks(), prior, now)),
                    Optional.of(next));
        }
        return Detection.saveOnly(next);
    }

    private static TransitionEvent event(TransitionKind kind, List<String> affected,
                                         TransitionState prior, Instant now) {
        // Stable across retries: the prior state only changes once delivery succeeded.
        String dedupKey = kind.value() + ":" + prior.updatedAt();
        return new TransitionEvent(kind, affected, now, dedupKey);
    }
}
