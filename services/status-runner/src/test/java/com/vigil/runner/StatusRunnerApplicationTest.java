package com.vigil.runner;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.vigil.aggregation.transition.Notifier;
import com.vigil.engine.ExecutorRegistry;
import com.vigil.runner.config.VigilProperties;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Starts the full application against a WireMock endpoint. The invocation runs during context
 * startup, so the assertions inspect what it left behind.
 */
@SpringBootTest
@DisplayName("Status Runner Application")
class StatusRunnerApplicationTest {

    private static final WireMockServer SERVER = new WireMockServer(options().dynamicPort());
    private static final Path DATA_DIR;

    static {
        SERVER.start();
        SERVER.stubFor(get("/health").willReturn(aResponse().withStatus(200).withBody("ok")));
        try {
            DATA_DIR = Files.createTempDirectory("vigil-runner-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private StatusInvocation invocation;

    @Autowired
    private VigilProperties properties;

    @DynamicPropertySource
    static void vigilProperties(DynamicPropertyRegistry registry) {
        registry.add("vigil.data-dir", DATA_DIR::toString);
        registry.add("vigil.summary-file", () -> DATA_DIR.resolve("site/summary.json").toString());
        registry.add("vigil.check-timeout", () -> "2s");
        registry.add("vigil.checks[0].id", () -> "api");
        registry.add("vigil.checks[0].name", () -> "API");
        registry.add("vigil.checks[0].type", () -> "http");
        registry.add("vigil.checks[0].params.url", () -> SERVER.baseUrl() + "/health");
        registry.add("vigil.checks[0].params.expected-body", () -> "ok");
    }

    @AfterAll
    static void stopServer() {
        SERVER.stop();
    }

    @Test
    @DisplayName("binds the configured checks and wires every executor")
    void contextLoads() {
        assertThat(properties.checks()).extracting(VigilProperties.Check::id).containsExactly("api");
        assertThat(properties.checks().get(0).params()).containsEntry("expected-body", "ok");
        assertThat(context.getBean(ExecutorRegistry.class).size()).isEqualTo(4);
        assertThat(context.getBean(Notifier.class)).isInstanceOf(LoggingNotifier.class);
    }

    @Test
    @DisplayName("the startup invocation probes the check and publishes the summary")
    void invocationRan() {
        assertThat(invocation.getExitCode()).isZero();
        SERVER.verify(getRequestedFor(urlEqualTo("/health")));
        assertThat(Files.exists(properties.summaryPath())).isTrue();
        assertThat(Files.exists(properties.statePath())).isTrue();
    }
}
