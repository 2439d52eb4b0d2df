package com.vigil.observability;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps credentials out of result messages and log output.
 * <p>
 * Two mechanisms: parameter maps are redacted by key name (api-key-env, trigger-token-env, ...),
 * and free text is scrubbed of known secret values and of {@code Bearer <token>} fragments.
 * All key matching is case-insensitive.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api-key", "credential"
    );

    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[^\\s\"',;]+");

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive key patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive key patterns (case-insensitive).
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with the values of sensitive keys replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     */
    public Map<String, String> redact(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(params.size());
        params.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /**
     * Replaces every occurrence of the given secret values, and any bearer token, in
     * {@code text}. Blank secrets are ignored.
     */
    public String scrub(String text, Collection<String> secrets) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String scrubbed = text;
        for (String secret : secrets) {
            if (secret != null && !secret.isBlank()) {
                scrubbed = scrubbed.replace(secret, REDACTED);
            }
        }
        return BEARER.matcher(scrubbed).replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
    }

    /**
     * Checks whether a key name matches any sensitive pattern (case-insensitive).
     */
    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        return compiledPattern.matcher(key).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
