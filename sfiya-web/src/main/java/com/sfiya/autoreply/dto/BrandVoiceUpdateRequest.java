package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BrandVoiceUpdateRequest {
    @Size(max = 120, message = "brand_name must be at most 120 characters")
    private String brandName;
    private List<String> brandValues;
    private List<String> personalityTraits;

    // Stored on the auto-reply settings record
    private List<String> catchphrases;
    private List<String> signatureEmojis;
    private String introLine;
    private String outroLine;
}
