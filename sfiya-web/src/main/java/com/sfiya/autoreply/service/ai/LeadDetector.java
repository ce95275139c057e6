package com.sfiya.autoreply.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.sfiya.autoreply.model.LeadTemperature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeadDetector {

    static final String SYSTEM_PROMPT =
            "Detect if this is a potential sales lead. Respond with ONLY valid JSON.\n" +
            "Format: {\"is_lead\": true/false, \"temperature\": \"hot|warm|cold\"}\n" +
            "\n" +
            "hot = Asking to buy, ready to transact, urgent\n" +
            "warm = Interested, asking questions, considering\n" +
            "cold = Not interested, just chatting";

    private final OpenAiClient openAiClient;
    private final StructuredOutputParser outputParser;

    public LeadResult detectLead(String text) {
        ChatRequest request = new ChatRequest(SYSTEM_PROMPT, "Is this a sales lead? \"" + text + "\"", 0.3, 50);

        AiResult<LeadResult> result = openAiClient.complete(request)
                .flatMap(outputParser::parseObject)
                .flatMap(LeadDetector::toLeadResult);

        if (!result.isOk()) {
            log.warn("Lead detection failed, treating as no lead: {}", result.error());
        }
        return result.orElse(LeadResult.NOT_A_LEAD);
    }

    static AiResult<LeadResult> toLeadResult(JsonNode node) {
        JsonNode leadNode = node.path("is_lead");
        if (!leadNode.isMissingNode() && !leadNode.isNull() && !leadNode.isBoolean()) {
            return AiResult.failure("is_lead is not a boolean: " + leadNode);
        }
        boolean lead = leadNode.asBoolean(false);
        LeadTemperature temperature = LeadTemperature.fromValue(node.path("temperature").asText(null))
                .orElse(LeadTemperature.COLD);
        return AiResult.ok(new LeadResult(lead, temperature));
    }
}
