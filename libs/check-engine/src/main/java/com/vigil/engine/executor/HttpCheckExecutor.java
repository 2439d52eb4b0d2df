package com.vigil.engine.executor;

import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.CheckType;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.engine.AbstractCheckExecutor;
import com.vigil.engine.CheckInvocation;
import com.vigil.engine.CheckOutcome;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.engine.probe.ProbeRequest;
import com.vigil.engine.probe.ProbeResponse;
import com.vigil.engine.probe.TransportException;
import com.vigil.observability.SensitiveDataRedactor;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Issues one HTTP request and compares status code and, optionally, a body substring.
 * <p>
 * Parameters: {@code url}, {@code method} (GET), {@code expected-status} (200),
 * {@code expected-body}, {@code api-key-env}, {@code payload}, {@code accept-client-errors},
 * {@code timeout}.
 */
public class HttpCheckExecutor extends AbstractCheckExecutor {

    static final Set<Integer> CLIENT_ERRORS = Set.of(400, 401, 403);

    static final Map<String, Object> DEFAULT_POST_BODY = Map.of(
            "inputs", Map.of(),
            "query", "ping",
            "response_mode", "blocking",
            "user", "status-checker",
            "auto_generate_name", false);

    public HttpCheckExecutor(ProbeClient client, SecretResolver secrets, SensitiveDataRedactor redactor) {
        super(client, secrets, redactor);
    }

    @Override
    public CheckType type() {
        return CheckType.HTTP;
    }

    @Override
    protected CheckOutcome probe(CheckInvocation invocation) {
        CheckDefinition definition = invocation.definition();
        String method = definition.param("method", "GET");
        int expectedStatus = definition.intParam("expected-status", 200);
        Optional<String> expectedBody = definition.param("expected-body");
        Optional<String> apiKey = invocation.optionalSecret("api-key-env");

        String body = null;
        if ("POST".equalsIgnoreCase(method) || "PUT".equalsIgnoreCase(method)) {
            body = definition.param("payload").orElseGet(() -> ProbeClient.toJson(DEFAULT_POST_BODY));
        }
        ProbeRequest request = new ProbeRequest(method, uri(definition), Map.of(), body, invocation.requestTimeout());
        if (body != null) {
            request = request.withHeader("Content-Type", "application/json");
        }
        if (apiKey.isPresent()) {
            request = request.withBearer(apiKey.get());
        }

        ProbeResponse response;
        try {
            response = client.send(request);
        } catch (TransportException e) {
            return CheckOutcome.of(invocation.result(CheckStatus.DOWN, CheckResult.NOT_MEASURED, e.getMessage()));
        }
        return CheckOutcome.of(evaluate(invocation, response, expectedStatus, expectedBody));
    }

    private CheckResult evaluate(CheckInvocation invocation, ProbeResponse response,
                                 int expectedStatus, Optional<String> expectedBody) {
        int status = response.statusCode();
        long elapsed = response.elapsedMs();
        if (status == expectedStatus) {
            if (expectedBody.isEmpty()) {
                return invocation.result(CheckStatus.UP, elapsed, "HTTP " + status);
            }
            String expected = expectedBody.get();
            return response.body().contains(expected)
                    ? invocation.result(CheckStatus.UP, elapsed, "HTTP " + status + ", body contains '" + expected + "'")
                    : invocation.result(CheckStatus.DOWN, elapsed, "HTTP " + status + ", body missing '" + expected + "'");
        }
        if (CLIENT_ERRORS.contains(status) && expectedBody.isEmpty()
                && invocation.definition().booleanParam("accept-client-errors", false)) {
            return invocation.result(CheckStatus.UP, elapsed,
                    "HTTP " + status + " (auth/input error, server is responding)");
        }
        return invocation.result(CheckStatus.DOWN, elapsed, "HTTP " + status + " (expected " + expectedStatus + ")");
    }

    private static URI uri(CheckDefinition definition) {
        String url = definition.requireParam("url");
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Check '" + definition.id() + "' has an invalid url: " + e.getMessage());
        }
    }
}
