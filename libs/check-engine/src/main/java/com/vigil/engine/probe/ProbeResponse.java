package com.vigil.engine.probe;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * What came back from a probe call.
 *
 * @param statusCode HTTP status
 * @param body       response body, never null
 * @param elapsed    wall time from send to fully received body
 */
public record ProbeResponse(int statusCode, String body, Duration elapsed) {

    public ProbeResponse {
        body = body == null ? "" : body;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public long elapsedMs() {
        return elapsed.toMillis();
    }

    public boolean isStatus(int expected) {
        return statusCode == expected;
    }

    /** Parses the body as JSON; empty when it is blank or malformed. */
    public Optional<JsonNode> json() {
        return ProbeClient.parseJson(body);
    }
}
