package com.sfiya.autoreply.service.ai;

import com.sfiya.autoreply.model.AutoReplySettings;
import com.sfiya.autoreply.model.BrandVoice;
import com.sfiya.autoreply.model.ReplyTone;
import com.sfiya.autoreply.model.Sentiment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the style specification sent with every reply request. Brand voice and settings are
 * both optional; without them the prompt falls back to a generic creator persona.
 */
@Component
public class ReplyPromptBuilder {

    public String buildSystemPrompt(ReplyTone tone, String language, BrandVoice brandVoice, AutoReplySettings settings) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an AI assistant generating replies for ").append(language).append(".\n\n");

        prompt.append("BRAND VOICE:\n");
        prompt.append(brandName(brandVoice)).append("\n");
        prompt.append("Values: ").append(joinOrNone(brandVoice != null ? brandVoice.getBrandValues() : null)).append("\n");
        prompt.append("Personality: ").append(joinOrNone(brandVoice != null ? brandVoice.getPersonalityTraits() : null)).append("\n\n");

        prompt.append("TONE TO USE: ").append(tone.getValue()).append("\n");
        prompt.append("Tone Examples:\n");
        for (ReplyTone example : ReplyTone.values()) {
            prompt.append("- ").append(example.getDisplayName()).append(": \"").append(example.getExample()).append("\"\n");
        }

        String special = specialInstructions(settings);
        if (!special.isEmpty()) {
            prompt.append("\nSPECIAL INSTRUCTIONS:\n").append(special);
        }

        prompt.append("\nRULES:\n");
        prompt.append("- Keep reply SHORT (1-3 sentences max)\n");
        prompt.append("- Sound HUMAN, not robotic\n");
        prompt.append("- Match the TONE perfectly\n");
        prompt.append("- Match the LANGUAGE (").append(language).append(")\n");
        prompt.append("- Never repeat generic responses\n");
        prompt.append("- Avoid all policy violations\n");
        if (settings != null && hasItems(settings.getBlacklistedWords())) {
            prompt.append("- NEVER use these words: ").append(String.join(", ", settings.getBlacklistedWords())).append("\n");
        }
        return prompt.toString();
    }

    public String buildUserPrompt(String commentText, ReplyTone tone, String language, Sentiment sentiment) {
        return "Generate a " + tone.getValue() + " reply in " + language + " to this "
                + sentiment.getValue() + " comment: \"" + commentText + "\"";
    }

    private String specialInstructions(AutoReplySettings settings) {
        if (settings == null) return "";
        StringBuilder special = new StringBuilder();
        if (hasItems(settings.getCatchphrases())) {
            special.append("- Must include: ").append(String.join(", ", settings.getCatchphrases())).append("\n");
        }
        if (hasItems(settings.getSignatureEmojis())) {
            special.append("- Must use these emojis: ").append(String.join(", ", settings.getSignatureEmojis())).append("\n");
        }
        if (hasText(settings.getIntroLine())) {
            special.append("- Start with: ").append(settings.getIntroLine()).append("\n");
        }
        if (hasText(settings.getOutroLine())) {
            special.append("- End with: ").append(settings.getOutroLine()).append("\n");
        }
        return special.toString();
    }

    private static String brandName(BrandVoice brandVoice) {
        if (brandVoice == null || !hasText(brandVoice.getBrandName())) {
            return BrandVoice.DEFAULT_BRAND_NAME;
        }
        return brandVoice.getBrandName();
    }

    private static String joinOrNone(List<String> items) {
        return hasItems(items) ? String.join(", ", items) : "none specified";
    }

    private static boolean hasItems(List<String> items) {
        return items != null && !items.isEmpty();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
