package com.sfiya.autoreply.service;

import com.sfiya.autoreply.dto.BrandVoiceUpdateRequest;
import com.sfiya.autoreply.exception.ResourceNotFoundException;
import com.sfiya.autoreply.model.BrandVoice;
import com.sfiya.autoreply.repository.BrandVoiceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class BrandVoiceService {

    private final BrandVoiceRepository brandVoiceRepository;
    private final AutoReplySettingsService settingsService;

    @Transactional(readOnly = true)
    public BrandVoice getBrandVoice(String userId) {
        return brandVoiceRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Brand voice not found"));
    }

    /**
     * Saves the brand identity and the voice details kept on the settings record in one
     * transaction. The brand voice row is created on first update; settings must exist.
     */
    @Transactional
    public BrandVoice updateBrandVoice(String userId, BrandVoiceUpdateRequest request) {
        settingsService.updateVoiceDetails(userId, request.getCatchphrases(), request.getSignatureEmojis(),
                request.getIntroLine(), request.getOutroLine());

        BrandVoice brandVoice = brandVoiceRepository.findById(userId)
                .orElseGet(() -> new BrandVoice(userId));

        if (request.getBrandName() != null && !request.getBrandName().isBlank()) {
            brandVoice.setBrandName(request.getBrandName().trim());
        }
        if (request.getBrandValues() != null) {
            brandVoice.setBrandValues(AutoReplySettingsService.clean(request.getBrandValues()));
        }
        if (request.getPersonalityTraits() != null) {
            brandVoice.setPersonalityTraits(AutoReplySettingsService.clean(request.getPersonalityTraits()));
        }
        brandVoice.setUpdatedAt(LocalDateTime.now());

        log.info("Updating brand voice for user {}", userId);
        return brandVoiceRepository.save(brandVoice);
    }
}
