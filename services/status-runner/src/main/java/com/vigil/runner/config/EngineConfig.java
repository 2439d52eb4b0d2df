package com.vigil.runner.config;

import com.vigil.aggregation.Aggregator;
import com.vigil.aggregation.SummaryPublisher;
import com.vigil.aggregation.transition.FileTransitionStateStore;
import com.vigil.aggregation.transition.Notifier;
import com.vigil.aggregation.transition.TransitionMonitor;
import com.vigil.engine.CheckRunner;
import com.vigil.engine.CycleCorrelator;
import com.vigil.engine.ExecutorRegistry;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.executor.CheckExecutors;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.observability.EngineMetrics;
import com.vigil.observability.SpanHelper;
import com.vigil.resultstore.JsonlResultStore;
import com.vigil.resultstore.PartitionLayout;
import com.vigil.runner.LoggingNotifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the plain library classes into the application context. The libraries carry no Spring
 * annotations; everything they need is passed in here.
 */
@Configuration(proxyBeanMethods = false)
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry registry,
                                       @Value("${spring.application.name:vigil}") String serviceName) {
        return new EngineMetrics(registry, serviceName);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpanHelper spanHelper() {
        return SpanHelper.from(GlobalOpenTelemetry.get());
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretResolver secretResolver() {
        return SecretResolver.environment();
    }

    @Bean
    public JsonlResultStore resultStore(VigilProperties properties) {
        return new JsonlResultStore(new PartitionLayout(properties.dataPath()));
    }

    @Bean
    public CycleCorrelator cycleCorrelator(JsonlResultStore store, VigilProperties properties) {
        return new CycleCorrelator(store, properties.pendingDeadlineMultiplier());
    }

    @Bean
    public ProbeClient probeClient(VigilProperties properties) {
        return ProbeClient.create(properties.checkTimeout());
    }

    @Bean
    public ExecutorRegistry executorRegistry(ProbeClient client, SecretResolver secrets, CycleCorrelator correlator) {
        return new ExecutorRegistry(CheckExecutors.standard(client, secrets, correlator));
    }

    @Bean
    public CheckRunner checkRunner(ExecutorRegistry registry, JsonlResultStore store, EngineMetrics metrics,
                                   SpanHelper spans, VigilProperties properties, Clock clock) {
        return new CheckRunner(registry, store, metrics, spans, properties.engineSettings(), clock);
    }

    @Bean
    public Aggregator aggregator(JsonlResultStore store, VigilProperties properties, Clock clock) {
        return new Aggregator(store, properties.retentionDays(), clock);
    }

    @Bean
    public SummaryPublisher summaryPublisher(VigilProperties properties) {
        return new SummaryPublisher(properties.summaryPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier() {
        return new LoggingNotifier();
    }

    @Bean
    public TransitionMonitor transitionMonitor(VigilProperties properties, Notifier notifier,
                                               EngineMetrics metrics, Clock clock) {
        return new TransitionMonitor(new FileTransitionStateStore(properties.statePath()), notifier, metrics, clock);
    }
}
