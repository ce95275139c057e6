package com.sfiya.autoreply.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin client for an OpenAI-compatible chat completions endpoint. Never throws: transport
 * errors, timeouts and unusable payloads all come back as {@link AiResult#failure(String)}.
 */
@Service
@Slf4j
public class OpenAiClient {

    private final String apiKey;
    private final String organization;
    private final String baseUrl;
    private final String model;
    private final RestTemplate restTemplate;

    public OpenAiClient(@Value("${app.ai.key:}") String apiKey,
                        @Value("${app.ai.organization:}") String organization,
                        @Value("${app.ai.base-url:https://api.openai.com/v1}") String baseUrl,
                        @Value("${app.ai.model:gpt-4-turbo}") String model,
                        RestTemplate restTemplate) {
        this.apiKey = apiKey;
        this.organization = organization;
        this.baseUrl = baseUrl;
        this.model = model;
        this.restTemplate = restTemplate;
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank() && !apiKey.contains("OPENAI_API_KEY");
    }

    public AiResult<String> complete(ChatRequest request) {
        if (!isEnabled()) {
            return AiResult.failure("AI key not configured");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", List.of(
                    Map.of("role", "system", "content", request.systemPrompt()),
                    Map.of("role", "user", "content", request.userPrompt())
            ));
            body.put("temperature", request.temperature());
            body.put("max_tokens", request.maxTokens());
            if (request.frequencyPenalty() != null) {
                body.put("frequency_penalty", request.frequencyPenalty());
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(apiKey);
            if (organization != null && !organization.isBlank()) {
                headers.set("OpenAI-Organization", organization);
            }

            JsonNode response = restTemplate.postForObject(
                    baseUrl + "/chat/completions", new HttpEntity<>(body, headers), JsonNode.class);
            return extractContent(response);
        } catch (RuntimeException e) {
            log.warn("Chat completion call failed: {}", e.getMessage());
            return AiResult.failure("Chat completion call failed: " + e.getMessage());
        }
    }

    // choices[0].message.content
    private AiResult<String> extractContent(JsonNode response) {
        if (response == null) {
            return AiResult.failure("Empty response body");
        }
        JsonNode choice = response.path("choices").path(0);
        if (choice.isMissingNode()) {
            return AiResult.failure("Response has no choices");
        }
        if ("content_filter".equals(choice.path("finish_reason").asText())) {
            return AiResult.failure("Completion rejected by content filter");
        }
        JsonNode content = choice.path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            return AiResult.failure("Completion has no text content");
        }
        return AiResult.ok(content.asText().trim());
    }
}
