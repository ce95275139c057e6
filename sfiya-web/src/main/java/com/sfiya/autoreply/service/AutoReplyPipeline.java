package com.sfiya.autoreply.service;

import com.sfiya.autoreply.dto.ReplyDecision;
import com.sfiya.autoreply.dto.ReplySummary;
import com.sfiya.autoreply.exception.DuplicateReplyException;
import com.sfiya.autoreply.exception.ReplyPipelineException;
import com.sfiya.autoreply.exception.SettingsNotFoundException;
import com.sfiya.autoreply.model.AutoReply;
import com.sfiya.autoreply.model.AutoReplySettings;
import com.sfiya.autoreply.model.AutoReplyStatus;
import com.sfiya.autoreply.model.Platform;
import com.sfiya.autoreply.model.ReplyOrigin;
import com.sfiya.autoreply.model.ReplyStatus;
import com.sfiya.autoreply.model.ReplyTone;
import com.sfiya.autoreply.model.Sentiment;
import com.sfiya.autoreply.repository.AutoReplyRepository;
import com.sfiya.autoreply.repository.CommentRepository;
import com.sfiya.autoreply.service.ai.LeadDetector;
import com.sfiya.autoreply.service.ai.LeadResult;
import com.sfiya.autoreply.service.ai.ReplyGenerator;
import com.sfiya.autoreply.service.ai.SentimentClassifier;
import com.sfiya.autoreply.service.ai.SentimentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.function.IntSupplier;

/**
 * Runs one comment through classification, the spam and hate gates, auto-like, reply
 * generation and lead detection. Steps run strictly in order and each one writes only
 * the comment fields it owns.
 * <p>
 * AI failures never surface here; the adapters already substituted their defaults. What does
 * surface is a missing settings record and any failed write to the comment or reply ledger,
 * which abort the run. Recording the auto-like is the exception: it is logged and skipped.
 * <p>
 * A comment is decided once. A run on a comment that already has a reply or is no longer
 * {@code PENDING} is rejected with {@link DuplicateReplyException} before anything is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoReplyPipeline {

    static final String SPAM_REASON = "Spam detected";
    static final String HATE_REASON = "Hate comment - escalated to user";

    private final AutoReplySettingsService settingsService;
    private final SentimentClassifier sentimentClassifier;
    private final ReplyGenerator replyGenerator;
    private final LeadDetector leadDetector;
    private final CommentRepository commentRepository;
    private final AutoReplyRepository autoReplyRepository;
    private final PlatformActionGateway platformActionGateway;

    public ReplyDecision process(IncomingComment comment) {
        String commentId = comment.commentId();
        AutoReplySettings settings = loadSettings(comment);
        ensureUndecided(commentId);

        SentimentResult classification = sentimentClassifier.classify(comment.commentText());
        Sentiment sentiment = classification.sentiment();
        writeComment(commentId, "classification", () -> commentRepository.updateClassification(
                commentId, sentiment.getValue(), classification.score(), LocalDateTime.now()));

        if (sentiment == Sentiment.SPAM && settings.isIgnoreSpam()) {
            writeComment(commentId, "ignored status",
                    () -> commentRepository.updateStatus(commentId, AutoReplyStatus.IGNORED, LocalDateTime.now()));
            log.info("Comment {} ignored as spam", commentId);
            return ReplyDecision.ignored(SPAM_REASON);
        }

        if (sentiment == Sentiment.HATE && settings.isIgnoreHateComments()) {
            writeComment(commentId, "escalated status",
                    () -> commentRepository.updateStatus(commentId, AutoReplyStatus.ESCALATED, LocalDateTime.now()));
            log.info("Comment {} escalated as hate", commentId);
            return ReplyDecision.escalated(HATE_REASON);
        }

        if (sentiment == Sentiment.POSITIVE && settings.isAutoLikePositive() && comment.platform() == Platform.INSTAGRAM) {
            recordLike(comment);
        }

        ReplyTone tone = settings.getDefaultTone() != null ? settings.getDefaultTone() : ReplyTone.POLITE;
        String language = settings.getDefaultLanguage() != null ? settings.getDefaultLanguage() : AutoReplySettings.DEFAULT_LANGUAGE;
        String replyText = replyGenerator.generate(comment.commentText(), comment.userId(), tone, language, sentiment);

        AutoReply saved = storeReply(comment, replyText, tone, language);

        LeadResult lead = leadDetector.detectLead(comment.commentText());
        if (lead.lead()) {
            String leadTag = sentiment.asLeadTag(lead.temperature());
            writeComment(commentId, "lead tag", () -> commentRepository.updateStatusAndSentiment(
                    commentId, AutoReplyStatus.REPLIED, leadTag, LocalDateTime.now()));
            log.info("Comment {} flagged as {} lead", commentId, lead.temperature().getValue());
        } else {
            writeComment(commentId, "replied status",
                    () -> commentRepository.updateStatus(commentId, AutoReplyStatus.REPLIED, LocalDateTime.now()));
        }

        return ReplyDecision.replied(new ReplySummary(
                saved.getId(),
                replyText,
                tone.getValue(),
                language,
                sentiment.getValue(),
                lead.lead(),
                lead.temperature().getValue()));
    }

    private AutoReplySettings loadSettings(IncomingComment comment) {
        try {
            return settingsService.getSettings(comment.userId());
        } catch (SettingsNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReplyPipelineException(comment.commentId(), "Settings lookup failed for user " + comment.userId(), e);
        }
    }

    private void ensureUndecided(String commentId) {
        boolean replied;
        try {
            replied = autoReplyRepository.existsByCommentId(commentId);
        } catch (RuntimeException e) {
            throw new ReplyPipelineException(commentId, "Reply lookup failed", e);
        }
        if (replied) {
            throw new DuplicateReplyException(commentId, DuplicateReplyException.REPLY_EXISTS);
        }
    }

    private void recordLike(IncomingComment comment) {
        try {
            int rows = commentRepository.markLiked(comment.commentId(), LocalDateTime.now());
            if (rows == 0) {
                log.warn("Auto-like skipped, comment {} not found", comment.commentId());
                return;
            }
            platformActionGateway.requestLike(comment.userId(), comment.commentId(), comment.platform());
        } catch (RuntimeException e) {
            log.warn("Auto-like failed for comment {}, continuing", comment.commentId(), e);
        }
    }

    private AutoReply storeReply(IncomingComment comment, String replyText, ReplyTone tone, String language) {
        AutoReply reply = new AutoReply();
        reply.setUserId(comment.userId());
        reply.setCommentId(comment.commentId());
        reply.setReplyText(replyText);
        reply.setToneUsed(tone);
        reply.setLanguageUsed(language);
        reply.setReplyStatus(ReplyStatus.PENDING);
        reply.setCreatedBy(ReplyOrigin.AI);
        try {
            return autoReplyRepository.saveAndFlush(reply);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReplyException(comment.commentId(), e);
        } catch (RuntimeException e) {
            throw new ReplyPipelineException(comment.commentId(), "Failed to store auto reply", e);
        }
    }

    private void writeComment(String commentId, String what, IntSupplier update) {
        int rows;
        try {
            rows = update.getAsInt();
        } catch (RuntimeException e) {
            throw new ReplyPipelineException(commentId, "Failed to persist " + what, e);
        }
        if (rows == 0) {
            if (commentExists(commentId)) {
                throw new DuplicateReplyException(commentId, DuplicateReplyException.ALREADY_PROCESSED);
            }
            throw new ReplyPipelineException(commentId, "Comment not found while persisting " + what);
        }
    }

    private boolean commentExists(String commentId) {
        try {
            return commentRepository.existsById(commentId);
        } catch (RuntimeException e) {
            throw new ReplyPipelineException(commentId, "Comment lookup failed", e);
        }
    }
}
