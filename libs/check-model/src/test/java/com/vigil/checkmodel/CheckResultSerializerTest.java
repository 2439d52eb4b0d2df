package com.vigil.checkmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CheckResultSerializer")
class CheckResultSerializerTest {

    private static final Instant TEN_AM = Instant.parse("2026-03-02T10:00:00Z");

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("writes snake_case fields and lower-case status")
        void writesWireFormat() {
            var json = CheckResultSerializer.serialize(
                    CheckResult.of("api", TEN_AM, CheckStatus.UP, 120, "HTTP 200"));

            assertThat(json)
                    .contains("\"check_id\":\"api\"")
                    .contains("\"timestamp\":\"2026-03-02T10:00:00Z\"")
                    .contains("\"status\":\"up\"")
                    .contains("\"response_time_ms\":120")
                    .contains("\"message\":\"HTTP 200\"")
                    .doesNotContain("\n");
        }

        @Test
        @DisplayName("omits pending fields on single-phase results")
        void omitsNullPendingFields() {
            var json = CheckResultSerializer.serialize(
                    CheckResult.of("api", TEN_AM, CheckStatus.DOWN, -1, "Timeout"));

            assertThat(json).doesNotContain("pending_token").doesNotContain("cycle_phase")
                    .doesNotContain("sample");
        }

        @Test
        @DisplayName("writes pending token and cycle phase for two-cycle results")
        void writesPhaseFields() {
            var json = CheckResultSerializer.serialize(CheckResult.phased("kb", TEN_AM, CheckStatus.UP,
                    900_000, "Indexing completed", "abc", CyclePhase.VERIFY));

            assertThat(json).contains("\"pending_token\":\"abc\"").contains("\"cycle_phase\":\"verify\"");
        }
    }

    @Nested
    @DisplayName("deserialize()")
    class Deserialize {

        @Test
        @DisplayName("reads a line written by serialize()")
        void readsWrittenLine() {
            var original = CheckResult.phased("kb", TEN_AM, CheckStatus.DOWN, -1, "Upload failed",
                    "tok-1", CyclePhase.START);

            assertThat(CheckResultSerializer.deserialize(CheckResultSerializer.serialize(original)))
                    .isEqualTo(original);
        }

        @Test
        @DisplayName("ignores unknown fields")
        void ignoresUnknownFields() {
            var line = "{\"check_id\":\"api\",\"timestamp\":\"2026-03-02T10:00:00Z\",\"status\":\"degraded\","
                    + "\"response_time_ms\":5,\"message\":\"\",\"provisional\":true}";

            assertThat(CheckResultSerializer.deserialize(line).status()).isEqualTo(CheckStatus.DEGRADED);
        }

        @Test
        @DisplayName("rejects malformed JSON")
        void rejectsMalformed() {
            assertThatThrownBy(() -> CheckResultSerializer.deserialize("{\"check_id\":"))
                    .isInstanceOf(CheckResultSerializer.RecordSerializationException.class);
            assertThat(CheckResultSerializer.tryDeserialize("not json")).isEmpty();
        }

        @Test
        @DisplayName("rejects records violating invariants")
        void rejectsInvalidRecord() {
            var line = "{\"check_id\":\"api\",\"timestamp\":\"2026-03-02T10:00:00Z\",\"status\":\"sideways\","
                    + "\"response_time_ms\":5}";

            assertThatThrownBy(() -> CheckResultSerializer.deserialize(line))
                    .isInstanceOf(CheckResultSerializer.RecordSerializationException.class);
        }

        @Test
        @DisplayName("reads pending entries with attributes")
        void readsPendingEntry() {
            var entry = new PendingEntry("kb", "abc", TEN_AM, TEN_AM.plusSeconds(2700),
                    Map.of("document_id", "doc-1", "batch_id", "b-1"));

            var json = CheckResultSerializer.write(entry, "pending entry");

            assertThat(json).contains("\"created_at\":\"2026-03-02T10:00:00Z\"");
            assertThat(CheckResultSerializer.read(json, PendingEntry.class)).isEqualTo(entry);
        }
    }
}
