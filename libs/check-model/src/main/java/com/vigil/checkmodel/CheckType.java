package com.vigil.checkmodel;

import java.util.List;
import java.util.Optional;

/**
 * All probe kinds the engine knows how to execute.
 *
 * <p>The {@code value} field holds the canonical string used in configuration ({@code type: http}).
 * Each type also declares the parameters a definition must carry to be runnable.
 */
public enum CheckType {

    /** Single HTTP request; status code and optional body substring decide the outcome. */
    HTTP("http", false, List.of("url")),

    /** Semantic-search query; presence of an expected response field decides the outcome. */
    RETRIEVE("retrieve", false, List.of("base-url", "dataset-id-env", "api-key-env")),

    /** Two-cycle: upload a document, then observe that indexing completed. */
    KNOWLEDGE("knowledge", true, List.of("base-url", "dataset-id-env", "api-key-env")),

    /** Two-cycle: trigger a workflow webhook, then observe that the workflow run succeeded. */
    WEBHOOK("webhook", true, List.of("trigger-url", "trigger-token-env", "base-url", "api-key-env"));

    private final String value;
    private final boolean twoPhase;
    private final List<String> requiredParams;

    CheckType(String value, boolean twoPhase, List<String> requiredParams) {
        this.value = value;
        this.twoPhase = twoPhase;
        this.requiredParams = requiredParams;
    }

    /** The canonical string representation used in configuration (e.g. "http"). */
    public String value() {
        return value;
    }

    /** Whether checks of this type span two invocations ({@code start} then {@code verify}). */
    public boolean isTwoPhase() {
        return twoPhase;
    }

    /** Parameter names that must be present and non-blank on a definition of this type. */
    public List<String> requiredParams() {
        return requiredParams;
    }

    /**
     * Looks up a CheckType by its canonical string value (case-insensitive).
     *
     * @param value the string to match (e.g. "knowledge")
     * @return the matching CheckType, or empty if not found
     */
    public static Optional<CheckType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CheckType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
