package com.sfiya.autoreply.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@Entity
@Table(name = "auto_reply_settings")
public class AutoReplySettings {
    public static final String DEFAULT_LANGUAGE = "english";

    @Id
    private String userId;

    @Enumerated(EnumType.STRING)
    private ReplyTone defaultTone = ReplyTone.POLITE;
    private String defaultLanguage = DEFAULT_LANGUAGE;

    private boolean ignoreSpam = true;
    private boolean ignoreHateComments = true;
    private boolean autoLikePositive = false;
    private boolean replyToComments = true;
    private boolean replyToDms = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "settings_catchphrases", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "phrase")
    private List<String> catchphrases = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "settings_signature_emojis", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "emoji")
    private List<String> signatureEmojis = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "settings_blacklisted_words", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "word")
    private List<String> blacklistedWords = new ArrayList<>();

    private String introLine;
    private String outroLine;

    private LocalDateTime updatedAt = LocalDateTime.now();

    public AutoReplySettings(String userId) {
        this.userId = userId;
    }
}
