package com.sfiya.autoreply.model;

import java.util.Arrays;
import java.util.Optional;

public enum ReplyTone {
    HYPE("hype", "YESS! This is exactly what I needed! 🔥"),
    FUNNY("funny", "Haha, you just made my day 😂"),
    FORMAL("formal", "Thank you for your feedback. We appreciate your input."),
    POLITE("polite", "Thanks so much for the kind words! Really appreciate it 🙏"),
    ANGRY("angry", "Seriously? That's not cool at all."),
    SAVAGE("savage", "Okay, that's fair. You win this round 😏"),
    ROASTING("roasting", "Well, well, well... you tried 😅");

    private final String value;
    private final String example;

    ReplyTone(String value, String example) {
        this.value = value;
        this.example = example;
    }

    public String getValue() {
        return value;
    }

    public String getExample() {
        return example;
    }

    public String getDisplayName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    public static Optional<ReplyTone> fromValue(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
