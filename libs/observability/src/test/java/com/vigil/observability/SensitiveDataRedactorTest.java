package com.vigil.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("redacts sensitive parameter keys only")
    void redactsParams() {
        Map<String, String> redacted = redactor.redact(Map.of(
                "url", "https://api.example.test",
                "api-key-env", "API_KEY",
                "trigger-token-env", "HOOK_TOKEN"));

        assertThat(redacted)
                .containsEntry("url", "https://api.example.test")
                .containsEntry("api-key-env", SensitiveDataRedactor.REDACTED)
                .containsEntry("trigger-token-env", SensitiveDataRedactor.REDACTED);
        assertThat(redactor.redact(null)).isEmpty();
    }

    @Test
    @DisplayName("scrubs known secret values from free text")
    void scrubsSecrets() {
        String scrubbed = redactor.scrub("POST https://hooks.test/trigger/s3cr3t failed", List.of("s3cr3t", ""));

        assertThat(scrubbed).isEqualTo("POST https://hooks.test/trigger/[REDACTED] failed");
    }

    @Test
    @DisplayName("scrubs bearer tokens even when the value is unknown")
    void scrubsBearer() {
        assertThat(redactor.scrub("header was Authorization: Bearer abc.def-123", List.of()))
                .isEqualTo("header was Authorization: Bearer [REDACTED]");
    }

    @Test
    @DisplayName("supports custom patterns")
    void customPatterns() {
        var custom = new SensitiveDataRedactor(Set.of("dataset"));

        assertThat(custom.isSensitive("dataset-id-env")).isTrue();
        assertThat(custom.isSensitive("url")).isFalse();
        assertThat(custom.isSensitive(null)).isFalse();
    }
}
