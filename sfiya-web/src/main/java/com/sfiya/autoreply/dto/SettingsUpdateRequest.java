package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Partial update: {@code null} fields keep their stored value.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SettingsUpdateRequest {
    private String defaultTone;
    private String defaultLanguage;
    private Boolean autoLikePositive;
    private Boolean ignoreSpam;
    private Boolean ignoreHateComments;
    private Boolean replyToComments;
    private Boolean replyToDms;
    private List<String> blacklistedWords;
}
