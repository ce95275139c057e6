package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionAction {
    IGNORED("ignored"),
    ESCALATED("escalated"),
    REPLIED("replied");

    private final String value;

    DecisionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
