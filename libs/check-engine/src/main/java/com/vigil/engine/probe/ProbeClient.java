package com.vigil.engine.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * Thin wrapper over {@link HttpClient} used by every executor.
 * <p>
 * Each request carries its own timeout. Anything that prevents a response from arriving is
 * reported as a {@link TransportException}; any HTTP status, including 5xx, is a response.
 */
public class ProbeClient {

    private static final Logger log = LoggerFactory.getLogger(ProbeClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient httpClient;

    public ProbeClient(HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient must not be null");
        }
        this.httpClient = httpClient;
    }

    /** Creates a client with HTTP/1.1 and the given connect timeout. */
    public static ProbeClient create(Duration connectTimeout) {
        return new ProbeClient(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    /**
     * Sends the request and reads the whole body.
     *
     * @throws TransportException if no response was received
     */
    public ProbeResponse send(ProbeRequest request) throws TransportException {
        HttpRequest httpRequest;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(request.uri())
                    .timeout(request.timeout())
                    .header("Accept", "application/json")
                    .method(request.method(), request.body() == null
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(request.body()));
            request.headers().forEach(builder::header);
            httpRequest = builder.build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid request: " + e.getMessage(), false, e);
        }

        long started = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.debug("{} {} -> {} in {}ms", request.method(), request.uri().getPath(),
                    response.statusCode(), elapsed.toMillis());
            return new ProbeResponse(response.statusCode(), response.body(), elapsed);
        } catch (HttpTimeoutException e) {
            throw new TransportException("Timeout after " + request.timeout().toSeconds() + "s", true, e);
        } catch (IOException e) {
            throw new TransportException("Connection error: " + describe(e), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted", false, e);
        }
    }

    /** Serializes a request body. */
    public static String toJson(Object body) {
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    static Optional<JsonNode> parseJson(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JSON.readTree(body));
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
