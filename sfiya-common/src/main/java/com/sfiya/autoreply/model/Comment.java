package com.sfiya.autoreply.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "comments", indexes = {
    @Index(name = "idx_comments_user_status", columnList = "user_id, auto_reply_status")
})
public class Comment {
    @Id
    private String id; // Assigned upstream by the ingestion collaborator

    @Column(nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    private Platform platform;

    @Column(columnDefinition = "TEXT")
    private String commentText;

    private String sentiment; // category value or composite lead tag
    private Double sentimentScore;
    private boolean liked = false; // Recorded intent, not confirmed delivery

    @Enumerated(EnumType.STRING)
    private AutoReplyStatus autoReplyStatus = AutoReplyStatus.PENDING;

    private LocalDateTime createdAt = LocalDateTime.now();
    private LocalDateTime updatedAt;

    public Comment() {
    }

    public Comment(String id, String userId, Platform platform, String commentText) {
        this.id = id;
        this.userId = userId;
        this.platform = platform;
        this.commentText = commentText;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getCommentText() { return commentText; }
    public void setCommentText(String commentText) { this.commentText = commentText; }

    public String getSentiment() { return sentiment; }
    public void setSentiment(String sentiment) { this.sentiment = sentiment; }

    public Double getSentimentScore() { return sentimentScore; }
    public void setSentimentScore(Double sentimentScore) { this.sentimentScore = sentimentScore; }

    public boolean isLiked() { return liked; }
    public void setLiked(boolean liked) { this.liked = liked; }

    public AutoReplyStatus getAutoReplyStatus() { return autoReplyStatus; }
    public void setAutoReplyStatus(AutoReplyStatus autoReplyStatus) { this.autoReplyStatus = autoReplyStatus; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
