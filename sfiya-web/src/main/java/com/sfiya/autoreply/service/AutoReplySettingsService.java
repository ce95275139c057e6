package com.sfiya.autoreply.service;

import com.sfiya.autoreply.dto.SettingsUpdateRequest;
import com.sfiya.autoreply.exception.SettingsNotFoundException;
import com.sfiya.autoreply.model.AutoReplySettings;
import com.sfiya.autoreply.model.ReplyTone;
import com.sfiya.autoreply.repository.AutoReplySettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AutoReplySettingsService {

    private final AutoReplySettingsRepository settingsRepository;

    @Transactional(readOnly = true)
    public AutoReplySettings getSettings(String userId) {
        return settingsRepository.findById(userId)
                .orElseThrow(() -> new SettingsNotFoundException(userId));
    }

    @Transactional
    public AutoReplySettings updateSettings(String userId, SettingsUpdateRequest request) {
        AutoReplySettings settings = getSettings(userId);

        if (request.getDefaultTone() != null) {
            settings.setDefaultTone(parseTone(request.getDefaultTone()));
        }
        if (request.getDefaultLanguage() != null && !request.getDefaultLanguage().isBlank()) {
            settings.setDefaultLanguage(request.getDefaultLanguage().trim());
        }
        if (request.getAutoLikePositive() != null) settings.setAutoLikePositive(request.getAutoLikePositive());
        if (request.getIgnoreSpam() != null) settings.setIgnoreSpam(request.getIgnoreSpam());
        if (request.getIgnoreHateComments() != null) settings.setIgnoreHateComments(request.getIgnoreHateComments());
        if (request.getReplyToComments() != null) settings.setReplyToComments(request.getReplyToComments());
        if (request.getReplyToDms() != null) settings.setReplyToDms(request.getReplyToDms());
        if (request.getBlacklistedWords() != null) {
            settings.setBlacklistedWords(clean(request.getBlacklistedWords()));
        }

        settings.setUpdatedAt(LocalDateTime.now());
        log.info("Updating auto-reply settings for user {}", userId);
        return settingsRepository.save(settings);
    }

    /**
     * Voice details live on the settings record but are edited together with the brand voice.
     */
    @Transactional
    public AutoReplySettings updateVoiceDetails(String userId, List<String> catchphrases, List<String> signatureEmojis,
                                                String introLine, String outroLine) {
        AutoReplySettings settings = getSettings(userId);
        if (catchphrases != null) settings.setCatchphrases(clean(catchphrases));
        if (signatureEmojis != null) settings.setSignatureEmojis(clean(signatureEmojis));
        if (introLine != null) settings.setIntroLine(introLine.isBlank() ? null : introLine.trim());
        if (outroLine != null) settings.setOutroLine(outroLine.isBlank() ? null : outroLine.trim());
        settings.setUpdatedAt(LocalDateTime.now());
        return settingsRepository.save(settings);
    }

    private static ReplyTone parseTone(String tone) {
        return ReplyTone.fromValue(tone)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported tone: " + tone));
    }

    static List<String> clean(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
