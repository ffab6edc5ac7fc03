package io.feedloom.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
 * Calls the Anthropic Messages API with a single user message.
 */
public final class AnthropicAiProvider implements AiProvider {
    private static final Logger log = LoggerFactory.getLogger(AnthropicAiProvider.class);
    public static final String DEFAULT_MODEL = "claude-sonnet-4-5-20250929";
    static final String API_VERSION = "2023-06-01";
    private static final int MAX_TOKENS = 4096;

    private final String apiKey;
    private final String model;
    private final URI endpoint;
    private final HttpClient http;

    public AnthropicAiProvider(String apiKey, String model, String endpoint) {
        this(apiKey, model, endpoint, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    AnthropicAiProvider(String apiKey, String model, String endpoint, HttpClient http) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        this.endpoint = URI.create(endpoint);
        this.http = http;
    }

    @Override
    public String id() {
        return "anthropic";
    }

    @Override
    public boolean isAvailable() {
        return !apiKey.isEmpty();
    }

    @Override
    public AiResult generate(String prompt, Duration timeout, CancellationSignal signal) {
        if (!isAvailable()) {
            return AiResult.fail(AiFailure.Kind.MISSING_CREDENTIALS, "no Anthropic API key configured");
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            return AiResult.fail(AiFailure.Kind.TIMEOUT, "Anthropic request timed out after " + timeout);
        } catch (IOException e) {
            return AiResult.fail(AiFailure.Kind.TRANSIENT, "Anthropic request failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AiResult.fail(AiFailure.Kind.CANCELED, "Anthropic request interrupted");
        }
        if (signal != null && signal.isCancelled()) {
            return AiResult.fail(AiFailure.Kind.CANCELED, "Anthropic request canceled");
        }
        return toResult(response.statusCode(), response.body());
    }

    static AiFailure.Kind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return AiFailure.Kind.MISSING_CREDENTIALS;
        }
        if (status == 429 || status == 408 || status == 529 || status >= 500) {
            return AiFailure.Kind.TRANSIENT;
        }
        return AiFailure.Kind.REJECTED;
    }

    private AiResult toResult(int status, String body) {
        if (status / 100 != 2) {
            log.debug("Anthropic returned status {}: {}", status, body);
            return AiResult.fail(classifyStatus(status), "Anthropic status=" + status + " " + errorMessage(body));
        }
        try {
            JsonNode root = Jsons.mapper().readTree(body);
            StringBuilder text = new StringBuilder();
            for (JsonNode block : root.path("content")) {
                if ("text".equals(block.path("type").asText("text"))) {
                    text.append(block.path("text").asText(""));
                }
            }
            String out = text.toString().strip();
            if (out.isEmpty()) {
                return AiResult.fail(AiFailure.Kind.TRANSIENT, "Anthropic returned no text");
            }
            return AiResult.ok(out);
        } catch (IOException e) {
            return AiResult.fail(AiFailure.Kind.TRANSIENT, "Anthropic response unreadable: " + e.getMessage());
        }
    }

    private String requestBody(String prompt) {
        ObjectNode root = Jsons.compact().createObjectNode();
        root.put("model", model);
        root.put("max_tokens", MAX_TOKENS);
        ArrayNode messages = root.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        message.put("content", prompt == null ? "" : prompt);
        try {
            return Jsons.compact().writeValueAsString(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode Anthropic request", e);
        }
    }

    private static String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode root = Jsons.mapper().readTree(body);
            return root.path("error").path("message").asText("");
        } catch (IOException e) {
            return "";
        }
    }
}
