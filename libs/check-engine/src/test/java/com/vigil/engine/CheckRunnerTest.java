package com.vigil.engine;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.CheckType;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.engine.executor.CheckExecutors;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.observability.EngineMetrics;
import com.vigil.observability.RunContext;
import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.observability.SpanHelper;
import com.vigil.resultstore.JsonlResultStore;
import com.vigil.resultstore.ResultStore;
import com.vigil.resultstore.StorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("CheckRunner")
class CheckRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path dataDir;

    private WireMockServer server;
    private JsonlResultStore store;
    private SimpleMeterRegistry meters;
    private InMemorySpanExporter spans;
    private CheckRunner runner;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        store = new JsonlResultStore(dataDir);
        meters = new SimpleMeterRegistry();
        spans = InMemorySpanExporter.create();
        runner = runnerWith(store, new ExecutorRegistry(CheckExecutors.standard(
                ProbeClient.create(Duration.ofSeconds(2)), SecretResolver.of(Map.of()), new CycleCorrelator(store))));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private CheckRunner runnerWith(ResultStore resultStore, ExecutorRegistry registry) {
        var tracer = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(spans)).build())
                .build()
                .getTracer("test");
        return new CheckRunner(registry, resultStore, new EngineMetrics(meters, "status-runner"),
                new SpanHelper(tracer), new EngineSettings(Duration.ofSeconds(2), Duration.ofMinutes(15), 0),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private CheckDefinition http(String id, String dependsOn, String path) {
        return new CheckDefinition(id, id, CheckType.HTTP, dependsOn, null, null, null, null,
                Map.of("url", server.baseUrl() + path));
    }

    @Test
    @DisplayName("appends every result under the invocation timestamp")
    void appendsResults() {
        server.stubFor(get(urlEqualTo("/api")).willReturn(aResponse().withStatus(200)));
        server.stubFor(get(urlEqualTo("/web")).willReturn(aResponse().withStatus(500)));

        RunReport report = runner.run(CheckDefinitionSet.of(List.of(http("api", null, "/api"), http("web", null, "/web"))));

        assertThat(report.statusOf("api")).contains(CheckStatus.UP);
        assertThat(report.statusOf("web")).contains(CheckStatus.DOWN);
        List<CheckResult> stored = store.readRange("api", NOW, NOW.plusSeconds(1));
        assertThat(stored).singleElement().extracting(CheckResult::status).isEqualTo(CheckStatus.UP);
        assertThat(store.readRange("web", NOW, NOW.plusSeconds(1))).hasSize(1);
    }

    @Test
    @DisplayName("dependents of a down check fail fast without network calls")
    void failFast() {
        server.stubFor(get(urlEqualTo("/api")).willReturn(aResponse().withStatus(503)));
        server.stubFor(get(urlEqualTo("/sandbox")).willReturn(aResponse().withStatus(200)));
        server.stubFor(get(urlEqualTo("/plugin")).willReturn(aResponse().withStatus(200)));

        RunReport report = runner.run(CheckDefinitionSet.of(List.of(
                http("api", null, "/api"), http("sandbox", "api", "/sandbox"), http("plugin", "api", "/plugin"))));

        assertThat(report.statusOf("sandbox")).contains(CheckStatus.DOWN);
        assertThat(report.outcomes().get("plugin").results().get(0).message()).isEqualTo("Dependency 'api' is down");
        server.verify(0, getRequestedFor(urlEqualTo("/sandbox")));
        server.verify(0, getRequestedFor(urlEqualTo("/plugin")));
        assertThat(meters.get(EngineMetrics.SKIPPED).tags("check", "sandbox", "reason", "dependency")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("each check runs in its own span and MDC context")
    void observability() {
        Map<String, String> seenMdc = new ConcurrentHashMap<>();
        CheckExecutor recording = new CheckExecutor() {
            @Override
            public CheckType type() {
                return CheckType.HTTP;
            }

            @Override
            public CheckOutcome execute(CheckDefinition definition, PriorCycleContext context) {
                seenMdc.put(definition.id(), MDC.get(RunContext.MDC_CHECK_ID) + "@" + MDC.get(RunContext.MDC_RUN_ID));
                return CheckOutcome.of(CheckResult.of(definition.id(), context.now(), CheckStatus.UP, 5, "ok"));
            }
        };

        RunReport report = runnerWith(store, new ExecutorRegistry(List.of(recording)))
                .run(CheckDefinitionSet.of(List.of(http("api", null, "/api"))));

        assertThat(seenMdc).containsEntry("api", "api@" + report.runId());
        SpanData span = spans.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("check.execute");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("check.id"))).isEqualTo("api");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("check.type"))).isEqualTo("http");
        assertThat(meters.get(EngineMetrics.EXECUTIONS).tags("check", "api", "status", "up").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("logs check params with sensitive values redacted")
    void redactsLoggedParams() {
        server.stubFor(get(urlEqualTo("/api")).willReturn(aResponse().withStatus(200)));
        Logger logger = (Logger) LoggerFactory.getLogger(CheckRunner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            runner.run(CheckDefinitionSet.of(List.of(new CheckDefinition("api", "API", CheckType.HTTP, null,
                    null, null, null, null, Map.of("url", server.baseUrl() + "/api", "password", "hunter2")))));
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(line -> assertThat(line).contains("password=" + SensitiveDataRedactor.REDACTED))
                .noneSatisfy(line -> assertThat(line).contains("hunter2"));
    }

    @Test
    @DisplayName("refuses to run a type without executor")
    void missingExecutor() {
        CheckRunner httpOnly = runnerWith(store, new ExecutorRegistry(List.of()));

        assertThatThrownBy(() -> httpOnly.run(CheckDefinitionSet.of(List.of(http("api", null, "/api")))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no executor for check 'api'");
    }

    @Test
    @DisplayName("a storage failure aborts the invocation")
    void storageFailure() {
        server.stubFor(get(urlEqualTo("/api")).willReturn(aResponse().withStatus(200)));
        ResultStore broken = mock(ResultStore.class);
        doThrow(new StorageException("read-only file system")).when(broken).append(any());
        CheckRunner failing = runnerWith(broken, new ExecutorRegistry(CheckExecutors.standard(
                ProbeClient.create(Duration.ofSeconds(2)), SecretResolver.of(Map.of()), new CycleCorrelator(store))));

        assertThatThrownBy(() -> failing.run(CheckDefinitionSet.of(List.of(http("api", null, "/api")))))
                .isInstanceOf(StorageException.class);
    }
}
