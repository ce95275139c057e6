package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record ReplySummary(UUID id,
                           String text,
                           String tone,
                           String language,
                           String sentiment,
                           @JsonProperty("is_sales_lead") boolean salesLead,
                           @JsonProperty("lead_temperature") String leadTemperature) {
}
