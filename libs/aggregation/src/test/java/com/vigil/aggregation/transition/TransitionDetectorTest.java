package com.vigil.aggregation.transition;

import com.vigil.aggregation.BucketStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TransitionDetector")
class TransitionDetectorTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private final TransitionDetector detector = new TransitionDetector();

    @Nested
    @DisplayName("single comparisons")
    class Single {

        @Test
        @DisplayName("first observation is saved without an event")
        void firstObservation() {
            var detection = detector.detect(Optional.empty(), BucketStatus.DOWN, List.of("api"), T0);

            assertThat(detection.event()).isEmpty();
            assertThat(detection.toSave()).map(TransitionState::overallStatus).contains(BucketStatus.DOWN);
        }

        @Test
        @DisplayName("up to down is an incident naming the unhealthy checks")
        void incident() {
            var previous = new TransitionState(BucketStatus.UP, List.of(), T0);

            var detection = detector.detect(Optional.of(previous), BucketStatus.DOWN, List.of("api", "kb"),
                    T0.plusSeconds(900));

            assertThat(detection.event()).hasValueSatisfying(event -> {
                assertThat(event.kind()).isEqualTo(TransitionKind.INCIDENT);
                assertThat(event.affectedChecks()).containsExactly("api", "kb");
                assertThat(event.timestamp()).isEqualTo(T0.plusSeconds(900));
                assertThat(event.dedupKey()).isEqualTo("incident:" + T0);
            });
        }

        @Test
        @DisplayName("unhealthy to up is a recovery naming the previously unhealthy checks")
        void recovery() {
            var previous = new TransitionState(BucketStatus.DEGRADED, List.of("search"), T0);

            var detection = detector.detect(Optional.of(previous), BucketStatus.UP, List.of(), T0.plusSeconds(900));

            assertThat(detection.event()).hasValueSatisfying(event -> {
                assertThat(event.kind()).isEqualTo(TransitionKind.RECOVERED);
                assertThat(event.affectedChecks()).containsExactly("search");
            });
            assertThat(detection.toSave()).map(TransitionState::unhealthyChecks).contains(List.of());
        }

        @Test
        @DisplayName("down to degraded updates the state silently")
        void downToDegraded() {
            var previous = new TransitionState(BucketStatus.DOWN, List.of("api"), T0);

            var detection = detector.detect(Optional.of(previous), BucketStatus.DEGRADED, List.of("api"),
                    T0.plusSeconds(900));

            assertThat(detection.event()).isEmpty();
            assertThat(detection.toSave()).map(TransitionState::overallStatus).contains(BucketStatus.DEGRADED);
        }

        @Test
        @DisplayName("nodata neither notifies nor overwrites the state")
        void noData() {
            var previous = new TransitionState(BucketStatus.DOWN, List.of("api"), T0);

            var detection = detector.detect(Optional.of(previous), BucketStatus.NODATA, List.of(), T0.plusSeconds(900));

            assertThat(detection.event()).isEmpty();
            assertThat(detection.toSave()).isEmpty();
        }

        @Test
        @DisplayName("the same edge produces the same dedup key until the state moves on")
        void dedupStable() {
            var previous = new TransitionState(BucketStatus.UP, List.of(), T0);

            var first = detector.detect(Optional.of(previous), BucketStatus.DOWN, List.of("api"), T0.plusSeconds(900));
            var retry = detector.detect(Optional.of(previous), BucketStatus.DOWN, List.of("api"), T0.plusSeconds(1800));

            assertThat(first.event().orElseThrow().dedupKey()).isEqualTo(retry.event().orElseThrow().dedupKey());
        }
    }

    @Nested
    @DisplayName("sequences")
    class Sequences {

        @Test
        @DisplayName("one incident and one recovery across an outage")
        void outage() {
            List<TransitionEvent> events = replay(
                    BucketStatus.UP, BucketStatus.UP, BucketStatus.DOWN, BucketStatus.DOWN,
                    BucketStatus.DEGRADED, BucketStatus.DOWN, BucketStatus.UP, BucketStatus.UP);

            assertThat(events).extracting(TransitionEvent::kind)
                    .containsExactly(TransitionKind.INCIDENT, TransitionKind.RECOVERED);
        }

        @Test
        @DisplayName("a gap in data does not look like a recovery")
        void gapDuringOutage() {
            List<TransitionEvent> events = replay(
                    BucketStatus.UP, BucketStatus.DOWN, BucketStatus.NODATA, BucketStatus.NODATA, BucketStatus.DOWN);

            assertThat(events).extracting(TransitionEvent::kind).containsExactly(TransitionKind.INCIDENT);
        }

        @Test
        @DisplayName("a steady status produces nothing")
        void steady() {
            assertThat(replay(BucketStatus.UP, BucketStatus.UP, BucketStatus.UP)).isEmpty();
            assertThat(replay(BucketStatus.DOWN, BucketStatus.DOWN)).isEmpty();
        }

        private List<TransitionEvent> replay(BucketStatus... statuses) {
            List<TransitionEvent> events = new ArrayList<>();
            Optional<TransitionState> state = Optional.empty();
            Instant at = T0;
            for (BucketStatus status : statuses) {
                List<String> unhealthy = status.isUnhealthy() ? List.of("api") : List.of();
                var detection = detector.detect(state, status, unhealthy, at);
                detection.event().ifPresent(events::add);
                if (detection.toSave().isPresent()) {
                    state = detection.toSave();
                }
                at = at.plus(Duration.ofMinutes(15));
            }
            return events;
        }
    }
}
