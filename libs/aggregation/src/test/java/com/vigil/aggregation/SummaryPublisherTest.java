package com.vigil.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.resultstore.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SummaryPublisher")
class SummaryPublisherTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("writes the summary as snake_case JSON")
    void writes() throws Exception {
        var publisher = new SummaryPublisher(dir.resolve("site/status.json"));
        var day = new DailySummary(LocalDate.of(2026, 3, 2), BucketStatus.UP, 1, 100.0, 120,
                List.of(new HourlyBucket(9, BucketStatus.UP, 1, 100.0, 120)));
        var check = new CheckSummary("api", "API", "Public API", null, "pro", BucketStatus.UP, T0, 120,
                "HTTP 200", 100.0, List.of(day));

        publisher.publish(new StatusSummary(StatusSummary.label(BucketStatus.UP), BucketStatus.UP, T0, T0,
                List.of(day.date()), List.of(new OverallDay(day.date(), BucketStatus.UP)), List.of(check)));

        JsonNode json = JsonFiles.mapper().readTree(Files.readString(publisher.target()));
        assertThat(json.path("current_overall").asText()).isEqualTo("All Components Operational");
        assertThat(json.path("current_overall_status").asText()).isEqualTo("up");
        assertThat(json.path("dates").get(0).asText()).isEqualTo("2026-03-02");
        JsonNode api = json.path("checks").get(0);
        assertThat(api.path("plan_tier").asText()).isEqualTo("pro");
        assertThat(api.has("note")).isFalse();
        assertThat(api.path("days").get(0).path("hours").get(0).path("avg_response_ms").asLong()).isEqualTo(120);
        assertThat(json.has("unhealthy_checks")).isFalse();
    }

    @Test
    @DisplayName("an unwritable target is a storage error")
    void unwritable() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "file");
        var publisher = new SummaryPublisher(blocker.resolve("status.json"));

        assertThatThrownBy(() -> publisher.publish(new StatusSummary("No Data", BucketStatus.NODATA, null, T0,
                List.of(), List.of(), List.of())))
                .isInstanceOf(StorageException.class);
    }
}
