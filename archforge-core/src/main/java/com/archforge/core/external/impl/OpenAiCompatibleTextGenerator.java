package com.archforge.core.external.impl;

import com.archforge.core.config.ProjectConfig.GenerationConfig;
import com.archforge.core.external.TextGenerationException;
import com.archforge.core.external.TextGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Text generator backed by an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Status 429 and 5xx responses, timeouts and I/O errors are retryable. Other client
 * errors and a missing API key are not.
 */
public class OpenAiCompatibleTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleTextGenerator.class);

    static final String SYSTEM_PROMPT = "You are a senior TypeScript engineer. "
        + "Reply with the complete file content only. No explanations, no Markdown fences.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GenerationConfig config;
    private final String apiKey;

    /**
     * Creates a generator reading its API key from the configured environment variable.
     *
     * @param config generation settings
     */
    public OpenAiCompatibleTextGenerator(GenerationConfig config) {
        this(config, System.getenv(config.apiKeyEnv()));
    }

    public OpenAiCompatibleTextGenerator(GenerationConfig config, String apiKey) {
        this.config = config;
        this.apiKey = apiKey;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getId() {
        return "openai";
    }

    @Override
    public String generate(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new TextGenerationException(
                "No API key found in environment variable " + config.apiKeyEnv(), false);
        }

        log.debug("Text generation request - Model: {}, prompt: {} chars", config.model(), prompt.length());

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(completionsUrl()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
            .timeout(Duration.ofSeconds(config.timeoutSeconds()))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TextGenerationException("Text generation call failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextGenerationException("Text generation call interrupted", e, false);
        }

        int status = response.statusCode();
        if (status != 200) {
            log.error("Text generation API error: {} - {}", status, response.body());
            boolean retryable = status == 429 || status >= 500;
            throw new TextGenerationException("Text generation API error: " + status, retryable);
        }

        String content = extractContent(response.body());
        log.debug("Text generation response received: {} chars", content.length());
        return content;
    }

    String requestBody(String prompt) {
        Map<String, Object> body = Map.of(
            "model", config.model(),
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)),
            "temperature", config.temperature());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TextGenerationException("Failed to encode request: " + e.getMessage(), e, false);
        }
    }

    String extractContent(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new TextGenerationException("Response contains no choices", true);
            }
            return choices.get(0).path("message").path("content").asText("");
        } catch (JsonProcessingException e) {
            throw new TextGenerationException("Malformed response: " + e.getMessage(), e, true);
        }
    }

    private String completionsUrl() {
        String endpoint = config.endpoint();
        return endpoint.endsWith("/") ? endpoint + "chat/completions" : endpoint + "/chat/completions";
    }
}
