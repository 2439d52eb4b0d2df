package com.vigil.engine.probe;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One outbound probe call.
 *
 * @param method  HTTP method, upper case
 * @param uri     target
 * @param headers request headers
 * @param body    request body, or null for none
 * @param timeout whole-request timeout
 */
public record ProbeRequest(String method, URI uri, Map<String, String> headers, String body, Duration timeout) {

    public ProbeRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be blank");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri must not be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        method = method.toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ProbeRequest get(URI uri, Duration timeout) {
        return new ProbeRequest("GET", uri, Map.of(), null, timeout);
    }

    public static ProbeRequest post(URI uri, String jsonBody, Duration timeout) {
        return new ProbeRequest("POST", uri, Map.of("Content-Type", "application/json"), jsonBody, timeout);
    }

    public static ProbeRequest delete(URI uri, Duration timeout) {
        return new ProbeRequest("DELETE", uri, Map.of(), null, timeout);
    }

    /** Returns a copy carrying an extra header. */
    public ProbeRequest withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new ProbeRequest(method, uri, merged, body, timeout);
    }

    /** Returns a copy carrying {@code Authorization: Bearer <token>}. */
    public ProbeRequest withBearer(String token) {
        return withHeader("Authorization", "Bearer " + token);
    }
}
