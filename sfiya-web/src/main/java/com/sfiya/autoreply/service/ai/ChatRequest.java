package com.sfiya.autoreply.service.ai;

public record ChatRequest(String systemPrompt,
                          String userPrompt,
                          double temperature,
                          int maxTokens,
                          Double frequencyPenalty) {

    public ChatRequest(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        this(systemPrompt, userPrompt, temperature, maxTokens, null);
    }
}
