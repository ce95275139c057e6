package com.sfiya.autoreply.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Platform side effect the pipeline asked for. Rows are written as {@code REQUESTED};
 * the delivery worker moves them to {@code CONFIRMED} or {@code FAILED}.
 */
@Entity
@Table(name = "engagement_activity", indexes = {
    @Index(name = "idx_engagement_user_time", columnList = "user_id, created_at DESC")
})
public class EngagementActivity {
    public static final String ACTION_LIKE = "LIKE";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String userId;
    private String commentId;

    @Enumerated(EnumType.STRING)
    private Platform platform;

    private String actionType; // LIKE

    @Enumerated(EnumType.STRING)
    private ActivityStatus status = ActivityStatus.REQUESTED;

    private LocalDateTime createdAt = LocalDateTime.now();

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getCommentId() { return commentId; }
    public void setCommentId(String commentId) { this.commentId = commentId; }

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getActionType() { return actionType; }
    public void setActionType(String actionType) { this.actionType = actionType; }

    public ActivityStatus getStatus() { return status; }
    public void setStatus(ActivityStatus status) { this.status = status; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
