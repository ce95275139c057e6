package com.sfiya.autoreply.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "brand_voice")
public class BrandVoice {
    public static final String DEFAULT_BRAND_NAME = "Creator";

    @Id
    private String userId;

    private String brandName = DEFAULT_BRAND_NAME;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "brand_values", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "brand_value")
    private List<String> brandValues = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "brand_personality_traits", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "trait")
    private List<String> personalityTraits = new ArrayList<>();

    private LocalDateTime updatedAt = LocalDateTime.now();

    public BrandVoice(String userId) {
        this.userId = userId;
    }
}
