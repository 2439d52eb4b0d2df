package com.vigil.engine.executor;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.ConfigurationException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds endpoint URIs from a base-url parameter and path segments.
 */
final class Endpoints {

    private Endpoints() {
    }

    /** {@code {param}/{segment}/{segment}...}; segments are URL-encoded. */
    static URI resolve(CheckDefinition definition, String baseParam, String... segments) {
        return build(definition, definition.requireParam(baseParam), null, segments);
    }

    /** Like {@link #resolve} with a raw, already encoded query string. */
    static URI resolveWithQuery(CheckDefinition definition, String baseParam, String query, String... segments) {
        return build(definition, definition.requireParam(baseParam), query, segments);
    }

    private static URI build(CheckDefinition definition, String base, String query, String... segments) {
        StringBuilder url = new StringBuilder(stripTrailingSlash(base));
        for (String segment : segments) {
            url.append('/').append(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        if (query != null && !query.isEmpty()) {
            url.append('?').append(query);
        }
        try {
            return URI.create(url.toString());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Check '" + definition.id() + "' has an invalid endpoint: " + e.getMessage());
        }
    }

    static String query(String name, String value) {
        return name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String base) {
        String trimmed = base.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
