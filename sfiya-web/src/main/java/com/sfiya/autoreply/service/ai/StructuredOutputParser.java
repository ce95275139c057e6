package com.sfiya.autoreply.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses model output that is supposed to be a bare JSON object. Models sometimes wrap it
 * in a markdown code fence, which is stripped first. Anything after the object is rejected.
 */
@Component
public class StructuredOutputParser {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ObjectReader reader;

    public StructuredOutputParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public AiResult<JsonNode> parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return AiResult.failure("No output to parse");
        }
        try {
            JsonNode node = reader.readTree(stripCodeFence(raw));
            if (node == null || !node.isObject()) {
                return AiResult.failure("Expected a JSON object but got: " + abbreviate(raw));
            }
            return AiResult.ok(node);
        } catch (JsonProcessingException e) {
            return AiResult.failure("Malformed JSON output: " + abbreviate(raw));
        }
    }

    static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        return matcher.matches() ? matcher.group(1) : trimmed;
    }

    private static String abbreviate(String raw) {
        return raw.length() > 80 ? raw.substring(0, 80) + "..." : raw;
    }
}
