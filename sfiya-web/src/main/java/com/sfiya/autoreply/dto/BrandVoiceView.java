package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sfiya.autoreply.model.BrandVoice;

import java.time.LocalDateTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BrandVoiceView(String brandName,
                             List<String> brandValues,
                             List<String> personalityTraits,
                             LocalDateTime updatedAt) {

    public static BrandVoiceView from(BrandVoice brandVoice) {
        return new BrandVoiceView(
                brandVoice.getBrandName(),
                SettingsView.present(brandVoice.getBrandValues()),
                SettingsView.present(brandVoice.getPersonalityTraits()),
                brandVoice.getUpdatedAt());
    }
}
