package com.sfiya.autoreply.model;

import java.util.Arrays;
import java.util.Optional;

public enum Platform {
    INSTAGRAM("instagram"),
    YOUTUBE("youtube"),
    FACEBOOK("facebook"),
    TIKTOK("tiktok"),
    TWITTER("twitter"),
    LINKEDIN("linkedin");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<Platform> fromValue(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(p -> p.value.equals(normalized))
                .findFirst();
    }
}
