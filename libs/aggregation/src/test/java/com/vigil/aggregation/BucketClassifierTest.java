package com.vigil.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BucketClassifier")
class BucketClassifierTest {

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("no samples is nodata")
        void empty() {
            assertThat(BucketClassifier.classify(0, 0, 0)).isEqualTo(BucketStatus.NODATA);
        }

        @Test
        @DisplayName("all up is up, any degraded without down is degraded")
        void upAndDegraded() {
            assertThat(BucketClassifier.classify(4, 0, 0)).isEqualTo(BucketStatus.UP);
            assertThat(BucketClassifier.classify(4, 0, 1)).isEqualTo(BucketStatus.DEGRADED);
        }

        @Test
        @DisplayName("half or more down is down, less is degraded")
        void downShare() {
            assertThat(BucketClassifier.classify(4, 1, 0)).isEqualTo(BucketStatus.DEGRADED);
            assertThat(BucketClassifier.classify(4, 2, 0)).isEqualTo(BucketStatus.DOWN);
            assertThat(BucketClassifier.classify(1, 1, 0)).isEqualTo(BucketStatus.DOWN);
            assertThat(BucketClassifier.classify(24, 1, 0)).isEqualTo(BucketStatus.DEGRADED);
        }

        @Test
        @DisplayName("more down samples never improve the status")
        void monotonic() {
            for (int total = 1; total <= 30; total++) {
                BucketStatus previous = BucketClassifier.classify(total, 0, 0);
                for (int down = 1; down <= total; down++) {
                    BucketStatus current = BucketClassifier.classify(total, down, 0);
                    assertThat(current.severity()).isGreaterThanOrEqualTo(previous.severity());
                    previous = current;
                }
            }
        }

        @Test
        @DisplayName("rejects inconsistent counts")
        void invalid() {
            assertThatThrownBy(() -> BucketClassifier.classify(2, 3, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BucketClassifier.classify(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("uptimePct")
    class Uptime {

        @Test
        @DisplayName("rounds to one decimal")
        void rounding() {
            assertThat(BucketClassifier.uptimePct(24, 1)).isEqualTo(95.8);
            assertThat(BucketClassifier.uptimePct(3, 1)).isEqualTo(66.7);
        }

        @Test
        @DisplayName("stays within 0 and 100, null without samples")
        void bounds() {
            assertThat(BucketClassifier.uptimePct(10, 0)).isEqualTo(100.0);
            assertThat(BucketClassifier.uptimePct(10, 10)).isEqualTo(0.0);
            assertThat(BucketClassifier.uptimePct(0, 0)).isNull();
        }
    }

    @Nested
    @DisplayName("overall")
    class Overall {

        @Test
        @DisplayName("worst-of with nodata excluded")
        void worstOf() {
            assertThat(BucketStatus.overall(List.of(BucketStatus.UP, BucketStatus.NODATA))).isEqualTo(BucketStatus.UP);
            assertThat(BucketStatus.overall(List.of(BucketStatus.UP, BucketStatus.DEGRADED, BucketStatus.DOWN)))
                    .isEqualTo(BucketStatus.DOWN);
            assertThat(BucketStatus.overall(List.of(BucketStatus.NODATA, BucketStatus.DEGRADED)))
                    .isEqualTo(BucketStatus.DEGRADED);
        }

        @Test
        @DisplayName("nodata only when nothing else is known")
        void noData() {
            assertThat(BucketStatus.overall(List.of())).isEqualTo(BucketStatus.NODATA);
            assertThat(BucketStatus.overall(List.of(BucketStatus.NODATA, BucketStatus.NODATA)))
                    .isEqualTo(BucketStatus.NODATA);
        }

        @Test
        @DisplayName("labels each overall status")
        void labels() {
            assertThat(StatusSummary.label(BucketStatus.UP)).isEqualTo("All Components Operational");
            assertThat(StatusSummary.label(BucketStatus.DOWN)).isEqualTo("Partial Outage");
            assertThat(StatusSummary.label(BucketStatus.DEGRADED)).isEqualTo("Degraded Performance");
            assertThat(StatusSummary.label(BucketStatus.NODATA)).isEqualTo("No Data");
        }
    }
}
