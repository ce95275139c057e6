package com.sfiya.autoreply.service;

import com.sfiya.autoreply.dto.DecisionAction;
import com.sfiya.autoreply.dto.ReplyDecision;
import com.sfiya.autoreply.exception.DuplicateReplyException;
import com.sfiya.autoreply.model.AutoReplySettings;
import com.sfiya.autoreply.model.AutoReplyStatus;
import com.sfiya.autoreply.model.Comment;
import com.sfiya.autoreply.model.LeadTemperature;
import com.sfiya.autoreply.model.Platform;
import com.sfiya.autoreply.model.Sentiment;
import com.sfiya.autoreply.repository.AutoReplyRepository;
import com.sfiya.autoreply.repository.AutoReplySettingsRepository;
import com.sfiya.autoreply.repository.CommentRepository;
import com.sfiya.autoreply.repository.EngagementActivityRepository;
import com.sfiya.autoreply.service.ai.LeadDetector;
import com.sfiya.autoreply.service.ai.LeadResult;
import com.sfiya.autoreply.service.ai.ReplyGenerator;
import com.sfiya.autoreply.service.ai.SentimentClassifier;
import com.sfiya.autoreply.service.ai.SentimentResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs the pipeline against the real ledger tables to check that a comment is decided once.
 */
@DataJpaTest(properties = {
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect"
})
class AutoReplyPipelineLedgerTest {

    private static final String TEXT = "How much for the blue one?";

    @Autowired
    private CommentRepository commentRepository;

    @Autowired
    private AutoReplyRepository autoReplyRepository;

    @Autowired
    private AutoReplySettingsRepository settingsRepository;

    @Autowired
    private EngagementActivityRepository activityRepository;

    private SentimentClassifier sentimentClassifier;
    private LeadDetector leadDetector;
    private AutoReplyPipeline pipeline;

    @BeforeEach
    void setUp() {
        sentimentClassifier = mock(SentimentClassifier.class);
        leadDetector = mock(LeadDetector.class);
        ReplyGenerator replyGenerator = mock(ReplyGenerator.class);
        when(replyGenerator.generate(anyString(), anyString(), any(), anyString(), any()))
                .thenReturn("Check your DMs!");

        pipeline = new AutoReplyPipeline(
                new AutoReplySettingsService(settingsRepository),
                sentimentClassifier,
                replyGenerator,
                leadDetector,
                commentRepository,
                autoReplyRepository,
                new ActivityRecordingGateway(activityRepository));

        settingsRepository.saveAndFlush(new AutoReplySettings("user-1"));
        commentRepository.saveAndFlush(new Comment("c-1", "user-1", Platform.INSTAGRAM, TEXT));
    }

    private IncomingComment incoming() {
        return new IncomingComment("c-1", "user-1", TEXT, Platform.INSTAGRAM);
    }

    @Test
    void secondRunOnRepliedCommentKeepsLeadTagAndStatus() {
        when(sentimentClassifier.classify(TEXT)).thenReturn(new SentimentResult(Sentiment.QUESTION, 0.8));
        when(leadDetector.detectLead(TEXT)).thenReturn(new LeadResult(true, LeadTemperature.HOT));

        ReplyDecision first = pipeline.process(incoming());
        assertThat(first.action()).isEqualTo(DecisionAction.REPLIED);

        when(sentimentClassifier.classify(TEXT)).thenReturn(new SentimentResult(Sentiment.SPAM, 0.9));
        assertThatThrownBy(() -> pipeline.process(incoming()))
                .isInstanceOf(DuplicateReplyException.class)
                .hasMessage("Reply already generated for this comment");

        Comment comment = commentRepository.findById("c-1").orElseThrow();
        assertThat(comment.getAutoReplyStatus()).isEqualTo(AutoReplyStatus.REPLIED);
        assertThat(comment.getSentiment()).isEqualTo("question_lead_hot");
        assertThat(comment.getSentimentScore()).isEqualTo(0.8);
        assertThat(autoReplyRepository.count()).isEqualTo(1);
    }

    @Test
    void secondRunOnIgnoredCommentLeavesItIgnored() {
        when(sentimentClassifier.classify(TEXT)).thenReturn(new SentimentResult(Sentiment.SPAM, 0.9));

        ReplyDecision first = pipeline.process(incoming());
        assertThat(first.action()).isEqualTo(DecisionAction.IGNORED);

        when(sentimentClassifier.classify(TEXT)).thenReturn(new SentimentResult(Sentiment.POSITIVE, 0.95));
        assertThatThrownBy(() -> pipeline.process(incoming()))
                .isInstanceOf(DuplicateReplyException.class)
                .hasMessage("Comment already processed");

        Comment comment = commentRepository.findById("c-1").orElseThrow();
        assertThat(comment.getAutoReplyStatus()).isEqualTo(AutoReplyStatus.IGNORED);
        assertThat(comment.getSentiment()).isEqualTo("spam");
        assertThat(autoReplyRepository.existsByCommentId("c-1")).isFalse();
    }
}
