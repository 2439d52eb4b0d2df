package com.vigil.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.checkmodel.CheckType;
import com.vigil.checkmodel.PendingEntry;
import com.vigil.engine.CheckInvocation;
import com.vigil.engine.CycleCorrelator;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.engine.probe.ProbeRequest;
import com.vigil.engine.probe.ProbeResponse;
import com.vigil.engine.probe.TransportException;
import com.vigil.observability.SensitiveDataRedactor;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Triggers a workflow through its webhook, then looks the run up in the workflow logs on the next
 * invocation. The claim token doubles as the trigger id the logs are searched by.
 */
public class WebhookCheckExecutor extends TwoPhaseCheckExecutor {

    static final String TOKEN_PREFIX = "status-check-";

    private static final SecureRandom RANDOM = new SecureRandom();

    public WebhookCheckExecutor(ProbeClient client, SecretResolver secrets, SensitiveDataRedactor redactor,
                                CycleCorrelator correlator) {
        super(client, secrets, redactor, correlator);
    }

    @Override
    public CheckType type() {
        return CheckType.WEBHOOK;
    }

    @Override
    protected String newToken() {
        byte[] bytes = new byte[6];
        RANDOM.nextBytes(bytes);
        return TOKEN_PREFIX + HexFormat.of().formatHex(bytes);
    }

    @Override
    protected StartAttempt start(CheckInvocation invocation, String token) throws TransportException {
        String triggerToken = invocation.secret("trigger-token-env");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", token);
        body.put("timestamp", invocation.now().getEpochSecond());

        ProbeResponse response = client.send(ProbeRequest.post(
                Endpoints.resolve(invocation.definition(), "trigger-url", triggerToken),
                ProbeClient.toJson(body), invocation.requestTimeout()));

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return StartAttempt.failed(response.elapsedMs(), "Webhook trigger failed: HTTP " + response.statusCode());
        }
        return StartAttempt.succeeded(response.elapsedMs(), "Webhook triggered", Map.of());
    }

    @Override
    protected Observation observe(CheckInvocation invocation, PendingEntry entry) throws TransportException {
        String apiKey = invocation.secret("api-key-env");
        ProbeResponse response = client.send(ProbeRequest.get(
                        Endpoints.resolveWithQuery(invocation.definition(), "base-url",
                                Endpoints.query("keyword", entry.token()) + "&limit=1", "workflows", "logs"),
                        invocation.requestTimeout())
                .withBearer(apiKey));

        if (!response.isStatus(200)) {
            return Observation.failed("Failed to fetch workflow logs: HTTP " + response.statusCode());
        }
        JsonNode data = response.json().map(node -> node.path("data")).orElse(null);
        if (data == null || !data.isArray() || data.isEmpty()) {
            return Observation.inProgress("trigger not yet processed");
        }

        JsonNode run = data.get(0).path("workflow_run");
        String status = run.path("status").asText("");
        return switch (status) {
            case "succeeded" -> Observation.completed(run.has("elapsed_time")
                    ? String.format(Locale.ROOT, "Webhook processed in %.1fs", run.path("elapsed_time").asDouble())
                    : "Webhook processed");
            case "failed" -> Observation.failed("Webhook processing failed: " + run.path("error").asText("unknown error"));
            default -> Observation.inProgress("status: " + (status.isEmpty() ? "unknown" : status));
        };
    }
}
