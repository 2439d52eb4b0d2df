package com.vigil.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.checkmodel.CheckDefinition;
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

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Uploads a small text document to a knowledge dataset, then verifies on the next invocation that
 * indexing completed. The test document is deleted once its claim resolves.
 */
public class KnowledgeCheckExecutor extends TwoPhaseCheckExecutor {

    static final String ATTR_DOCUMENT_ID = "document_id";
    static final String ATTR_BATCH = "batch";

    private static final DateTimeFormatter DOCUMENT_NAME_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    public KnowledgeCheckExecutor(ProbeClient client, SecretResolver secrets, SensitiveDataRedactor redactor,
                                  CycleCorrelator correlator) {
        super(client, secrets, redactor, correlator);
    }

    @Override
    public CheckType type() {
        return CheckType.KNOWLEDGE;
    }

    @Override
    protected StartAttempt start(CheckInvocation invocation, String token) throws TransportException {
        CheckDefinition definition = invocation.definition();
        String datasetId = invocation.secret("dataset-id-env");
        String apiKey = invocation.secret("api-key-env");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "status-check-" + DOCUMENT_NAME_TIME.format(invocation.now()));
        body.put("text", definition.param("text", "ping"));
        body.put("indexing_technique", "economy");
        body.put("process_rule", Map.of("mode", "automatic"));

        ProbeResponse response = client.send(ProbeRequest.post(
                        Endpoints.resolve(definition, "base-url", "datasets", datasetId, "document", "create-by-text"),
                        ProbeClient.toJson(body), invocation.requestTimeout())
                .withBearer(apiKey));

        if (!response.isStatus(200)) {
            return StartAttempt.failed(response.elapsedMs(), "Upload failed: HTTP " + response.statusCode());
        }
        Optional<JsonNode> json = response.json();
        String documentId = json.map(node -> node.path("document").path("id").asText("")).orElse("");
        String batch = json.map(node -> node.path("batch").asText("")).orElse("");
        if (documentId.isEmpty() || batch.isEmpty()) {
            return StartAttempt.failed(response.elapsedMs(), "Upload response missing document id or batch");
        }
        return StartAttempt.succeeded(response.elapsedMs(), "Document uploaded",
                Map.of(ATTR_DOCUMENT_ID, documentId, ATTR_BATCH, batch));
    }

    @Override
    protected Observation observe(CheckInvocation invocation, PendingEntry entry) throws TransportException {
        String datasetId = invocation.secret("dataset-id-env");
        String apiKey = invocation.secret("api-key-env");
        String batch = entry.attribute(ATTR_BATCH);
        if (batch == null) {
            return Observation.failed("Claim has no indexing batch");
        }

        ProbeResponse response = client.send(ProbeRequest.get(
                        Endpoints.resolve(invocation.definition(), "base-url",
                                "datasets", datasetId, "documents", batch, "indexing-status"),
                        invocation.requestTimeout())
                .withBearer(apiKey));

        if (!response.isStatus(200)) {
            return Observation.failed("Status check failed: HTTP " + response.statusCode());
        }
        JsonNode data = response.json().map(node -> node.path("data")).orElse(null);
        if (data == null || !data.isArray() || data.isEmpty()) {
            return Observation.failed("Status check returned empty data");
        }

        JsonNode document = data.get(0);
        String status = document.path("indexing_status").asText("");
        return switch (status) {
            case "completed" -> Observation.completed("Indexing completed");
            case "error" -> Observation.failed("Indexing failed: " + document.path("error").asText("unknown error"));
            default -> Observation.inProgress("status: " + (status.isEmpty() ? "unknown" : status));
        };
    }

    @Override
    protected void discard(CheckInvocation invocation, PendingEntry entry) throws TransportException {
        String documentId = entry.attribute(ATTR_DOCUMENT_ID);
        if (documentId == null) {
            return;
        }
        String datasetId = invocation.secret("dataset-id-env");
        String apiKey = invocation.secret("api-key-env");
        ProbeResponse response = client.send(ProbeRequest.delete(
                        Endpoints.resolve(invocation.definition(), "base-url",
                                "datasets", datasetId, "documents", documentId),
                        invocation.requestTimeout())
                .withBearer(apiKey));
        if (response.statusCode() >= 300) {
            throw new TransportException("Delete of document " + documentId + " returned HTTP "
                    + response.statusCode(), false, null);
        }
    }
}
