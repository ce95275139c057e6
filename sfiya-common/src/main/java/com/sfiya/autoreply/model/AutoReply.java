package com.sfiya.autoreply.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "auto_replies", uniqueConstraints = {
    @UniqueConstraint(name = "uk_auto_replies_comment", columnNames = "comment_id")
})
public class AutoReply {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    private String userId;

    @Column(name = "comment_id", nullable = false)
    private String commentId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String replyText;

    @Enumerated(EnumType.STRING)
    private ReplyTone toneUsed;

    private String languageUsed;

    @Enumerated(EnumType.STRING)
    private ReplyStatus replyStatus = ReplyStatus.PENDING;

    @Enumerated(EnumType.STRING)
    private ReplyOrigin createdBy = ReplyOrigin.AI;

    private LocalDateTime createdAt = LocalDateTime.now();

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getCommentId() { return commentId; }
    public void setCommentId(String commentId) { this.commentId = commentId; }

    public String getReplyText() { return replyText; }
    public void setReplyText(String replyText) { this.replyText = replyText; }

    public ReplyTone getToneUsed() { return toneUsed; }
    public void setToneUsed(ReplyTone toneUsed) { this.toneUsed = toneUsed; }

    public String getLanguageUsed() { return languageUsed; }
    public void setLanguageUsed(String languageUsed) { this.languageUsed = languageUsed; }

    public ReplyStatus getReplyStatus() { return replyStatus; }
    public void setReplyStatus(ReplyStatus replyStatus) { this.replyStatus = replyStatus; }

    public ReplyOrigin getCreatedBy() { return createdBy; }
    public void setCreatedBy(ReplyOrigin createdBy) { this.createdBy = createdBy; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
