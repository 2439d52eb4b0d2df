package com.vigil.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.checkmodel.CheckDefinition;
import com.vigil.checkmodel.CheckResult;
import com.vigil.checkmodel.CheckStatus;
import com.vigil.checkmodel.CheckType;
import com.vigil.engine.AbstractCheckExecutor;
import com.vigil.engine.CheckInvocation;
import com.vigil.engine.CheckOutcome;
import com.vigil.engine.SecretResolver;
import com.vigil.engine.probe.ProbeClient;
import com.vigil.engine.probe.ProbeRequest;
import com.vigil.engine.probe.ProbeResponse;
import com.vigil.engine.probe.TransportException;
import com.vigil.observability.SensitiveDataRedactor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one semantic-search query against a dataset. The presence of the expected field
 * ({@code records} by default) is the success criterion, whatever its content.
 */
public class RetrieveCheckExecutor extends AbstractCheckExecutor {

    public RetrieveCheckExecutor(ProbeClient client, SecretResolver secrets, SensitiveDataRedactor redactor) {
        super(client, secrets, redactor);
    }

    @Override
    public CheckType type() {
        return CheckType.RETRIEVE;
    }

    @Override
    protected CheckOutcome probe(CheckInvocation invocation) {
        CheckDefinition definition = invocation.definition();
        String datasetId = invocation.secret("dataset-id-env");
        String apiKey = invocation.secret("api-key-env");
        String expectedField = definition.param("expected-field", "records");

        ProbeRequest request = ProbeRequest.post(
                        Endpoints.resolve(definition, "base-url", "datasets", datasetId, "retrieve"),
                        ProbeClient.toJson(searchBody(definition.param("query", "test"))),
                        invocation.requestTimeout())
                .withBearer(apiKey);

        ProbeResponse response;
        try {
            response = client.send(request);
        } catch (TransportException e) {
            return CheckOutcome.of(invocation.result(CheckStatus.DOWN, CheckResult.NOT_MEASURED, e.getMessage()));
        }

        long elapsed = response.elapsedMs();
        if (!response.isStatus(200)) {
            return CheckOutcome.of(invocation.result(CheckStatus.DOWN, elapsed,
                    "HTTP " + response.statusCode() + " (expected 200)"));
        }
        Optional<JsonNode> json = response.json();
        if (json.isEmpty() || !json.get().has(expectedField)) {
            return CheckOutcome.of(invocation.result(CheckStatus.DOWN, elapsed,
                    "Response missing '" + expectedField + "' field"));
        }
        JsonNode field = json.get().get(expectedField);
        String detail = field.isArray() ? field.size() + " record(s) returned" : "'" + expectedField + "' present";
        return CheckOutcome.of(invocation.result(CheckStatus.UP, elapsed, "HTTP 200, " + detail));
    }

    static Map<String, Object> searchBody(String query) {
        Map<String, Object> reranking = new LinkedHashMap<>();
        reranking.put("reranking_provider_name", "");
        reranking.put("reranking_model_name", "");

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("search_method", "semantic_search");
        model.put("reranking_enable", false);
        model.put("reranking_mode", null);
        model.put("reranking_model", reranking);
        model.put("weights", null);
        model.put("top_k", 1);
        model.put("score_threshold_enabled", false);
        model.put("score_threshold", null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("retrieval_model", model);
        return body;
    }
}
