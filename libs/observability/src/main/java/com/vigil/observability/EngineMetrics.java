package com.vigil.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer instruments for check execution and transition detection.
 * <p>
 * Every meter carries a {@code service} tag so several engines can share one registry.
 * Additional tags identify the check and its outcome:
 * <ul>
 *   <li>{@value #EXECUTIONS} - counter, tags {@code check}, {@code type}, {@code status}</li>
 *   <li>{@value #DURATION} - timer, tags {@code check}, {@code type}</li>
 *   <li>{@value #SKIPPED} - counter, tags {@code check}, {@code reason}</li>
 *   <li>{@value #TRANSITIONS} - counter, tag {@code kind}</li>
 * </ul>
 */
public final class EngineMetrics {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    public static final String EXECUTIONS = "vigil.check.executions";
    public static final String DURATION = "vigil.check.duration";
    public static final String SKIPPED = "vigil.check.skipped";
    public static final String TRANSITIONS = "vigil.transition.events";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates metrics bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public EngineMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Counts one recorded result and times the probe that produced it.
     *
     * @param checkId check id
     * @param type    check type value (e.g. "http")
     * @param status  status value (e.g. "down")
     * @param elapsed wall-clock time spent executing the check
     */
    public void recordExecution(String checkId, String type, String status, Duration elapsed) {
        Counter.builder(EXECUTIONS)
                .description("Check results recorded")
                .tags(baseTags("check", checkId, "type", type, "status", status))
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Wall-clock time of check execution")
                .tags(baseTags("check", checkId, "type", type))
                .register(registry)
                .record(elapsed);
    }

    /**
     * Counts an execution that produced no sample (pending wait, no-op cycle).
     *
     * @param checkId check id
     * @param reason  short reason label (e.g. "pending")
     */
    public void recordSkipped(String checkId, String reason) {
        Counter.builder(SKIPPED)
                .description("Check executions that produced no sample")
                .tags(baseTags("check", checkId, "reason", reason))
                .register(registry)
                .increment();
    }

    /**
     * Counts an emitted transition event.
     *
     * @param kind event kind (e.g. "incident")
     */
    public void recordTransition(String kind) {
        Counter.builder(TRANSITIONS)
                .description("Status transition events handed to the notifier")
                .tags(baseTags("kind", kind))
                .register(registry)
                .increment();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
