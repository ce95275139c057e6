package com.sfiya.autoreply.service.ai;

import com.sfiya.autoreply.model.Sentiment;

public record SentimentResult(Sentiment sentiment, double score) {
    public static final double DEFAULT_SCORE = 0.5;
    public static final SentimentResult DEFAULT = new SentimentResult(Sentiment.NEUTRAL, DEFAULT_SCORE);
}
