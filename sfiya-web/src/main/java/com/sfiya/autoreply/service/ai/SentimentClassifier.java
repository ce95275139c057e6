package com.sfiya.autoreply.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.sfiya.autoreply.model.Sentiment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class SentimentClassifier {

    static final String SYSTEM_PROMPT =
            "You are a sentiment analyzer. Analyze the given text and respond with ONLY a JSON object (no markdown, no extra text).\n" +
            "\n" +
            "Format: {\"sentiment\": \"positive|negative|neutral|question|spam|hate\", \"score\": 0.0-1.0}\n" +
            "\n" +
            "Guidelines:\n" +
            "- \"positive\": Compliments, appreciation, love, excited\n" +
            "- \"negative\": Criticism, angry, disappointed, sad\n" +
            "- \"question\": Asking something, seeking info\n" +
            "- \"spam\": Repetitive, promotional, unrelated\n" +
            "- \"hate\": Abusive, insulting, threatening\n" +
            "- \"neutral\": Normal comment, just passing by";

    private final OpenAiClient openAiClient;
    private final StructuredOutputParser outputParser;

    /**
     * Classifies a comment. Any failure along the way yields {@link SentimentResult#DEFAULT}.
     */
    public SentimentResult classify(String text) {
        ChatRequest request = new ChatRequest(SYSTEM_PROMPT, "Analyze this comment: \"" + text + "\"", 0.3, 100);

        AiResult<SentimentResult> result = openAiClient.complete(request)
                .flatMap(outputParser::parseObject)
                .flatMap(SentimentClassifier::toSentimentResult);

        if (!result.isOk()) {
            log.warn("Sentiment analysis failed, defaulting to neutral: {}", result.error());
        }
        return result.orElse(SentimentResult.DEFAULT);
    }

    static AiResult<SentimentResult> toSentimentResult(JsonNode node) {
        JsonNode sentimentNode = node.path("sentiment");
        if (!sentimentNode.isTextual()) {
            return AiResult.failure("Missing sentiment field");
        }
        return Sentiment.fromValue(sentimentNode.asText())
                .map(sentiment -> AiResult.ok(new SentimentResult(sentiment, readScore(node.path("score")))))
                .orElseGet(() -> AiResult.failure("Unknown sentiment: " + sentimentNode.asText()));
    }

    private static double readScore(JsonNode scoreNode) {
        if (!scoreNode.isNumber()) {
            return SentimentResult.DEFAULT_SCORE;
        }
        return Math.max(0.0, Math.min(1.0, scoreNode.asDouble()));
    }
}
