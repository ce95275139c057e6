package com.sfiya.autoreply.service.ai;

import com.sfiya.autoreply.model.AutoReplySettings;
import com.sfiya.autoreply.model.BrandVoice;
import com.sfiya.autoreply.model.ReplyTone;
import com.sfiya.autoreply.model.Sentiment;
import com.sfiya.autoreply.repository.AutoReplySettingsRepository;
import com.sfiya.autoreply.repository.BrandVoiceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

@Service
@Slf4j
public class ReplyGenerator {

    public static final String FALLBACK_REPLY = "Thanks for your comment! 🙌";

    private static final double TEMPERATURE = 0.7;
    private static final double FREQUENCY_PENALTY = 0.5;

    private final OpenAiClient openAiClient;
    private final ReplyPromptBuilder promptBuilder;
    private final BrandVoiceRepository brandVoiceRepository;
    private final AutoReplySettingsRepository settingsRepository;
    private final int maxTokens;

    public ReplyGenerator(OpenAiClient openAiClient,
                          ReplyPromptBuilder promptBuilder,
                          BrandVoiceRepository brandVoiceRepository,
                          AutoReplySettingsRepository settingsRepository,
                          @Value("${app.ai.max-tokens:500}") int maxTokens) {
        this.openAiClient = openAiClient;
        this.promptBuilder = promptBuilder;
        this.brandVoiceRepository = brandVoiceRepository;
        this.settingsRepository = settingsRepository;
        this.maxTokens = maxTokens;
    }

    /**
     * Generates a short reply in the user's brand voice. Always returns non-empty text;
     * {@link #FALLBACK_REPLY} is used when the backend fails or returns nothing usable.
     */
    public String generate(String commentText, String userId, ReplyTone tone, String language, Sentiment sentiment) {
        ReplyTone effectiveTone = tone != null ? tone : ReplyTone.POLITE;
        String effectiveLanguage = language != null && !language.isBlank() ? language : AutoReplySettings.DEFAULT_LANGUAGE;

        BrandVoice brandVoice = load("brand voice", userId, () -> brandVoiceRepository.findById(userId));
        AutoReplySettings settings = load("settings", userId, () -> settingsRepository.findById(userId));

        ChatRequest request = new ChatRequest(
                promptBuilder.buildSystemPrompt(effectiveTone, effectiveLanguage, brandVoice, settings),
                promptBuilder.buildUserPrompt(commentText, effectiveTone, effectiveLanguage, sentiment),
                TEMPERATURE,
                maxTokens,
                FREQUENCY_PENALTY);

        AiResult<String> reply = openAiClient.complete(request);
        if (!reply.isOk()) {
            log.warn("Reply generation failed for user {}, using fallback: {}", userId, reply.error());
            return FALLBACK_REPLY;
        }
        return reply.value();
    }

    private <T> T load(String what, String userId, Supplier<Optional<T>> lookup) {
        try {
            return lookup.get().orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not load {} for user {}, generating without it", what, userId, e);
            return null;
        }
    }
}
