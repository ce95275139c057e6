package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sfiya.autoreply.model.AutoReplySettings;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettingsView(String defaultTone,
                           String defaultLanguage,
                           boolean ignoreSpam,
                           boolean ignoreHateComments,
                           boolean autoLikePositive,
                           boolean replyToComments,
                           boolean replyToDms,
                           List<String> catchphrases,
                           List<String> signatureEmojis,
                           List<String> blacklistedWords,
                           String introLine,
                           String outroLine,
                           LocalDateTime updatedAt) {

    public static SettingsView from(AutoReplySettings settings) {
        return new SettingsView(
                settings.getDefaultTone() != null ? settings.getDefaultTone().getValue() : null,
                settings.getDefaultLanguage(),
                settings.isIgnoreSpam(),
                settings.isIgnoreHateComments(),
                settings.isAutoLikePositive(),
                settings.isReplyToComments(),
                settings.isReplyToDms(),
                present(settings.getCatchphrases()),
                present(settings.getSignatureEmojis()),
                present(settings.getBlacklistedWords()),
                settings.getIntroLine(),
                settings.getOutroLine(),
                settings.getUpdatedAt());
    }

    // Element collections may hold null entries written outside this service
    static List<String> present(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }
}
