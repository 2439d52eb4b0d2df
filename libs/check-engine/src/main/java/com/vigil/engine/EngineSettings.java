package com.vigil.engine;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.ConfigurationException;

import java.time.Duration;

/**
 * Runtime knobs of the {@link CheckRunner}.
 *
 * @param checkTimeout    per-request timeout, and the base of the per-check execution bound
 * @param defaultInterval interval of checks that do not declare one
 * @param maxParallelism  worker threads; 0 means one per check
 * @param executionGrace  slack added to the request budget of each check
 */
public record EngineSettings(Duration checkTimeout, Duration defaultInterval, int maxParallelism,
                             Duration executionGrace) {

    public static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_EXECUTION_GRACE = Duration.ofSeconds(5);

    /** Requests one execution may issue: verify, cleanup and start of a two-phase check. */
    static final int REQUESTS_PER_EXECUTION = 3;

    public EngineSettings {
        checkTimeout = checkTimeout == null ? DEFAULT_CHECK_TIMEOUT : checkTimeout;
        defaultInterval = defaultInterval == null ? DEFAULT_INTERVAL : defaultInterval;
        executionGrace = executionGrace == null ? DEFAULT_EXECUTION_GRACE : executionGrace;
        if (checkTimeout.isZero() || checkTimeout.isNegative()) {
            throw new IllegalArgumentException("checkTimeout must be positive");
        }
        if (defaultInterval.isZero() || defaultInterval.isNegative()) {
            throw new IllegalArgumentException("defaultInterval must be positive");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("maxParallelism must be >= 0");
        }
        if (executionGrace.isNegative()) {
            throw new IllegalArgumentException("executionGrace must not be negative");
        }
    }

    public EngineSettings(Duration checkTimeout, Duration defaultInterval, int maxParallelism) {
        this(checkTimeout, defaultInterval, maxParallelism, DEFAULT_EXECUTION_GRACE);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_CHECK_TIMEOUT, DEFAULT_INTERVAL, 0);
    }

    /** Bound of a check that uses the engine's request timeout. */
    public Duration executionBound() {
        return boundFor(checkTimeout);
    }

    /**
     * Upper bound on one execution of {@code definition}, sized for three requests at the
     * check's own request timeout (its {@code timeout} param when larger than the engine's).
     */
    public Duration executionBound(CheckDefinition definition) {
        Duration requestTimeout = Duration.ofSeconds(configuredTimeoutSeconds(definition));
        return boundFor(requestTimeout.compareTo(checkTimeout) > 0 ? requestTimeout : checkTimeout);
    }

    // A malformed timeout is reported by the executor as a down result.
    private static int configuredTimeoutSeconds(CheckDefinition definition) {
        try {
            return Math.max(0, definition.intParam("timeout", 0));
        } catch (ConfigurationException e) {
            return 0;
        }
    }

    private Duration boundFor(Duration requestTimeout) {
        return requestTimeout.multipliedBy(REQUESTS_PER_EXECUTION).plus(executionGrace);
    }
}
