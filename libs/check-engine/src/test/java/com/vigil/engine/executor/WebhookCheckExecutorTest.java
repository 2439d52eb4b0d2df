package com.vigil.engine.executor;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.CheckType;
import com.vigil.checkmodel.CyclePhase;
import com.vigil.engine.CheckOutcome;
import com.vigil.engine.CycleCorrelator;
import com.vigil.engine.DependencyGate;
import com.vigil.engine.PriorCycleContext;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.resultstore.JsonlResultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookCheckExecutor")
class WebhookCheckExecutorTest {

    private static final String TRIGGER = "/triggers/webhook/hook-secret";
    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path dataDir;

    private WireMockServer server;
    private WebhookCheckExecutor executor;
    private CheckDefinition definition;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        executor = new WebhookCheckExecutor(ProbeClient.create(Duration.ofSeconds(2)),
                SecretResolver.of(Map.of("HOOK_TOKEN", "hook-secret", "APP_KEY", "app-secret")),
                new SensitiveDataRedactor(), new CycleCorrelator(new JsonlResultStore(dataDir)));
        definition = new CheckDefinition("webhook", "Webhook", CheckType.WEBHOOK, null, null, null, null,
                Duration.ofMinutes(15), Map.of(
                "trigger-url", server.baseUrl() + "/triggers/webhook",
                "trigger-token-env", "HOOK_TOKEN",
                "base-url", server.baseUrl() + "/v1",
                "api-key-env", "APP_KEY"));
        server.stubFor(post(urlEqualTo(TRIGGER)).willReturn(aResponse().withStatus(200).withBody("{}")));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private CheckOutcome runAt(Instant now) {
        return executor.execute(definition,
                new PriorCycleContext("run", now, DependencyGate.none(), Duration.ofSeconds(5), Duration.ofMinutes(15)));
    }

    private void logs(String body) {
        server.stubFor(get(urlPathEqualTo("/v1/workflows/logs")).willReturn(aResponse().withStatus(200).withBody(body)));
    }

    @Test
    @DisplayName("start posts the trigger id and never records the trigger token")
    void start() {
        CheckResult start = runAt(START).results().get(0);

        assertThat(start.pendingToken()).matches("status-check-[0-9a-f]{12}");
        assertThat(start.message()).doesNotContain("hook-secret");
        server.verify(postRequestedFor(urlEqualTo(TRIGGER))
                .withRequestBody(matchingJsonPath("$.id", equalTo(start.pendingToken())))
                .withRequestBody(matchingJsonPath("$.timestamp", equalTo(String.valueOf(START.getEpochSecond())))));
    }

    @Test
    @DisplayName("succeeded workflow run is up and looked up by trigger id")
    void succeeded() {
        String token = runAt(START).results().get(0).pendingToken();
        logs("{\"data\":[{\"workflow_run\":{\"status\":\"succeeded\",\"elapsed_time\":2.5}}]}");

        CheckOutcome outcome = runAt(START.plus(Duration.ofMinutes(15)));

        CheckResult verify = outcome.results().get(0);
        assertThat(verify.cyclePhase()).isEqualTo(CyclePhase.VERIFY);
        assertThat(verify.status()).isEqualTo(CheckStatus.UP);
        assertThat(verify.responseTimeMs()).isEqualTo(900_000);
        assertThat(verify.message()).isEqualTo("Webhook processed in 2.5s");
        server.verify(getRequestedFor(urlPathEqualTo("/v1/workflows/logs"))
                .withQueryParam("keyword", equalTo(token))
                .withQueryParam("limit", equalTo("1"))
                .withHeader("Authorization", equalTo("Bearer app-secret")));
    }

    @Test
    @DisplayName("no log entry yet keeps the claim pending")
    void notYetLogged() {
        runAt(START);
        logs("{\"data\":[]}");

        assertThat(runAt(START.plus(Duration.ofMinutes(15))).isSkipped()).isTrue();
        server.verify(1, postRequestedFor(urlEqualTo(TRIGGER)));
    }

    @Test
    @DisplayName("failed workflow run is down")
    void failed() {
        runAt(START);
        logs("{\"data\":[{\"workflow_run\":{\"status\":\"failed\",\"error\":\"node crashed\"}}]}");

        CheckResult verify = runAt(START.plus(Duration.ofMinutes(15))).results().get(0);

        assertThat(verify.status()).isEqualTo(CheckStatus.DOWN);
        assertThat(verify.message()).isEqualTo("Webhook processing failed: node crashed");
    }

    @Test
    @DisplayName("rejected trigger is a down start sample")
    void triggerRejected() {
        server.stubFor(post(urlEqualTo(TRIGGER)).willReturn(aResponse().withStatus(404)));

        CheckResult start = runAt(START).results().get(0);

        assertThat(start.status()).isEqualTo(CheckStatus.DOWN);
        assertThat(start.message()).isEqualTo("Webhook trigger failed: HTTP 404");
    }
}
