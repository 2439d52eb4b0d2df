package com.vigil.runner.config;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.CheckType;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.engine.EngineSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Type-safe configuration bound from the {@code vigil.*} prefix.
 *
 * <pre>
 * vigil:
 *   data-dir: data
 *   checks:
 *     - id: api
 *       name: API
 *       type: http
 *       params:
 *         url: https://api.example.com/health
 *         api-key-env: STATUS_API_KEY
 * </pre>
 *
 * <p>Check params hold the names of environment variables, never secret values.
 *
 * @param dataDir                   root of the result partitions and pending ledger
 * @param retentionDays             days of history in the summary (default 90)
 * @param checkTimeout              per-request timeout (default 30s)
 * @param defaultInterval           interval of checks that do not declare one (default 15m)
 * @param pendingDeadlineMultiplier intervals before an unresolved start expires (default 3)
 * @param maxParallelism            worker threads, 0 for one per check
 * @param summaryFile               where the status summary JSON is written
 * @param stateFile                 where the transition state is kept
 * @param checks                    check definitions, in display order
 */
@ConfigurationProperties(prefix = "vigil")
@Validated
public record VigilProperties(
        @NotBlank String dataDir,
        int retentionDays,
        Duration checkTimeout,
        Duration defaultInterval,
        int pendingDeadlineMultiplier,
        int maxParallelism,
        String summaryFile,
        String stateFile,
        @NotEmpty @Valid List<Check> checks) {

    public static final int DEFAULT_DEADLINE_MULTIPLIER = 3;

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean Validation.
     */
    public VigilProperties {
        if (retentionDays <= 0) {
            retentionDays = 90;
        }
        if (checkTimeout == null) {
            checkTimeout = EngineSettings.DEFAULT_CHECK_TIMEOUT;
        }
        if (defaultInterval == null) {
            defaultInterval = EngineSettings.DEFAULT_INTERVAL;
        }
        if (pendingDeadlineMultiplier <= 0) {
            pendingDeadlineMultiplier = DEFAULT_DEADLINE_MULTIPLIER;
        }
        if (maxParallelism < 0) {
            maxParallelism = 0;
        }
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    /**
     * One configured check.
     *
     * @param type one of http, retrieve, knowledge, webhook
     */
    public record Check(
            @NotBlank String id,
            @NotBlank String name,
            @NotBlank String type,
            String dependsOn,
            String description,
            String note,
            String planTier,
            Duration interval,
            Map<String, String> params) {
    }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public Path summaryPath() {
        return summaryFile == null || summaryFile.isBlank()
                ? dataPath().resolve("summary.json")
                : Path.of(summaryFile);
    }

    public Path statePath() {
        return stateFile == null || stateFile.isBlank()
                ? dataPath().resolve("transition-state.json")
                : Path.of(stateFile);
    }

    public EngineSettings engineSettings() {
        return new EngineSettings(checkTimeout, defaultInterval, maxParallelism);
    }

    /**
     * Converts and validates the configured checks.
     *
     * @throws ConfigurationException listing every problem found
     */
    public CheckDefinitionSet toDefinitions() {
        List<String> errors = new ArrayList<>();
        List<CheckDefinition> definitions = new ArrayList<>(checks.size());
        for (Check check : checks) {
            Optional<CheckType> type = CheckType.fromString(check.type());
            if (type.isEmpty()) {
                errors.add("check '" + check.id() + "' has unknown type '" + check.type() + "'");
                continue;
            }
            definitions.add(new CheckDefinition(check.id(), check.name(), type.get(), blankToNull(check.dependsOn()),
                    check.description(), check.note(), check.planTier(), check.interval(), check.params()));
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return CheckDefinitionSet.of(definitions);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
