package com.sfiya.autoreply.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Single-valued classification assigned to a comment. The lowercase value is what gets
 * persisted on {@link Comment#getSentiment()} and returned to callers.
 */
public enum Sentiment {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral"),
    QUESTION("question"),
    SPAM("spam"),
    HATE("hate");

    private final String value;

    Sentiment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Composite tag stored on the comment once it is flagged as a sales lead,
     * e.g. {@code question_lead_hot}.
     */
    public String asLeadTag(LeadTemperature temperature) {
        return value + "_lead_" + temperature.getValue();
    }

    public static Optional<Sentiment> fromValue(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst();
    }
}
