package com.sfiya.autoreply.model;

import java.util.Arrays;
import java.util.Optional;

public enum LeadTemperature {
    HOT("hot"),     // ready to buy
    WARM("warm"),   // interested, asking
    COLD("cold");

    private final String value;

    LeadTemperature(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<LeadTemperature> fromValue(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
