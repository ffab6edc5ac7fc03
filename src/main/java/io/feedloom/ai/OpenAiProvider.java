package io.feedloom.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.feedloom.task.CancellationSignal;
import io.feedloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Calls an OpenAI-compatible chat completions endpoint with a single user message.
 */
public final class OpenAiProvider implements AiProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiProvider.class);
    public static final String DEFAULT_MODEL = "gpt-4o";
    public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/chat/completions";
    private static final int MAX_TOKENS = 1024;

    private final String apiKey;
    private final String model;
    private final URI endpoint;
    private final HttpClient http;

    public OpenAiProvider(String apiKey, String model, String endpoint) {
        this(apiKey, model, endpoint, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    OpenAiProvider(String apiKey, String model, String endpoint, HttpClient http) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        this.endpoint = URI.create(endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim());
        this.http = http;
    }

    @Override
    public String id() {
        return "openai";
    }

    @Override
    public boolean isAvailable() {
        return !apiKey.isEmpty();
    }

    @Override
    public AiResult generate(String prompt, Duration timeout, CancellationSignal signal) {
        if (!isAvailable()) {
            return AiResult.fail(AiFailure.Kind.MISSING_CREDENTIALS, "no OpenAI API key configured");
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            return AiResult.fail(AiFailure.Kind.TIMEOUT, "OpenAI request timed out after " + timeout);
        } catch (IOException e) {
            return AiResult.fail(AiFailure.Kind.TRANSIENT, "OpenAI request failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AiResult.fail(AiFailure.Kind.CANCELED, "OpenAI request interrupted");
        }
        if (signal != null && signal.isCancelled()) {
            return AiResult.fail(AiFailure.Kind.CANCELED, "OpenAI request canceled");
        }
        return toResult(response.statusCode(), response.body());
    }

    static AiFailure.Kind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return AiFailure.Kind.MISSING_CREDENTIALS;
        }
        if (status == 429 || status == 408 || status >= 500) {
            return AiFailure.Kind.TRANSIENT;
        }
        return AiFailure.Kind.REJECTED;
    }

    private AiResult toResult(int status, String body) {
        if (status / 100 != 2) {
            log.debug("OpenAI returned status {}: {}", status, body);
            return AiResult.fail(classifyStatus(status), "OpenAI status=" + status + " " + errorMessage(body));
        }
        try {
            JsonNode choices = Jsons.mapper().readTree(body).path("choices");
            String out = choices.isArray() && !choices.isEmpty()
                    ? choices.get(0).path("message").path("content").asText("").strip()
                    : "";
            if (out.isEmpty()) {
                return AiResult.fail(AiFailure.Kind.TRANSIENT, "OpenAI returned no text");
            }
            return AiResult.ok(out);
        } catch (IOException e) {
            return AiResult.fail(AiFailure.Kind.TRANSIENT, "OpenAI response unreadable: " + e.getMessage());
        }
    }

    private String requestBody(String prompt) {
        ObjectNode root = Jsons.compact().createObjectNode();
        root.put("model", model);
        root.put("max_tokens", MAX_TOKENS);
        ObjectNode message = root.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt == null ? "" : prompt);
        try {
            return Jsons.compact().writeValueAsString(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode OpenAI request", e);
        }
    }

    private static String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(body).path("error").path("message").asText("");
        } catch (IOException e) {
            return "";
        }
    }
}
