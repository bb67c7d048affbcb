package com.chapterbus.worker;

import com.chapterbus.contract.FailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Worker served by a remote HTTP endpoint. The payload is POSTed as JSON and the
 * response body must be a JSON object.
 */
public class HttpWorkerCollaborator implements WorkerCollaborator {

    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};
    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final URI endpoint;
    private final String bearerToken;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public HttpWorkerCollaborator(String endpoint, String bearerToken, ObjectMapper mapper, HttpClient httpClient) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        this.endpoint = URI.create(normalize(endpoint));
        this.bearerToken = bearerToken;
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<Map<String, Object>> invoke(Map<String, Object> payload, Instant deadline) {
        HttpRequest request;
        try {
            request = buildRequest(payload, deadline);
        } catch (JsonProcessingException ex) {
            return CompletableFuture.failedFuture(
                new WorkerException(FailureKind.PROVIDER_ERROR, "payload is not serialisable: " + ex.getOriginalMessage(), ex));
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                if (error != null) {
                    throw translate(error);
                }
                return parse(response);
            });
    }

    private HttpRequest buildRequest(Map<String, Object> payload, Instant deadline) throws JsonProcessingException {
        Duration timeout = deadline == null ? Duration.ofMinutes(5) : Duration.between(Instant.now(), deadline);
        if (timeout.compareTo(MIN_TIMEOUT) < 0) {
            timeout = MIN_TIMEOUT;
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder.build();
    }

    Map<String, Object> parse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            throw new WorkerException(FailureKind.RATE_LIMITED, "worker endpoint " + endpoint + " rate limited the call");
        }
        if (status < 200 || status >= 300) {
            throw new WorkerException(FailureKind.PROVIDER_ERROR,
                "worker endpoint " + endpoint + " failed (" + status + ")");
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            throw new WorkerException(FailureKind.INVALID_RESPONSE, "worker endpoint " + endpoint + " returned no body");
        }
        try {
            Map<String, Object> result = mapper.readValue(body, OBJECT);
            if (result == null) {
                throw new WorkerException(FailureKind.INVALID_RESPONSE, "worker endpoint returned null");
            }
            return result;
        } catch (JsonProcessingException ex) {
            throw new WorkerException(FailureKind.INVALID_RESPONSE,
                "worker endpoint " + endpoint + " returned a non-object body", ex);
        }
    }

    private RuntimeException translate(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpTimeoutException) {
            return new WorkerException(FailureKind.DEADLINE_EXCEEDED, "worker endpoint " + endpoint + " timed out", cause);
        }
        if (cause instanceof IOException) {
            return new WorkerException(FailureKind.PROVIDER_ERROR, "worker endpoint " + endpoint + " unreachable: " + cause.getMessage(), cause);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new WorkerException(FailureKind.PROVIDER_ERROR, cause.getMessage(), cause);
    }

    private static String normalize(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
