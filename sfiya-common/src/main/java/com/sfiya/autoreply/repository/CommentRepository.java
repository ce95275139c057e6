package com.sfiya.autoreply.repository;

import com.sfiya.autoreply.model.AutoReplyStatus;
import com.sfiya.autoreply.model.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Field-level updates only. Each method returns the number of rows touched. The classification
 * and status writes only apply while the comment is still {@code PENDING}, so zero rows means
 * the comment is either missing or already decided.
 */
public interface CommentRepository extends JpaRepository<Comment, String> {

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Comment c SET c.sentiment = :sentiment, c.sentimentScore = :score, c.updatedAt = :now WHERE c.id = :id AND c.autoReplyStatus = com.sfiya.autoreply.model.AutoReplyStatus.PENDING")
    int updateClassification(@Param("id") String id,
                             @Param("sentiment") String sentiment,
                             @Param("score") Double score,
                             @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Comment c SET c.autoReplyStatus = :status, c.updatedAt = :now WHERE c.id = :id AND c.autoReplyStatus = com.sfiya.autoreply.model.AutoReplyStatus.PENDING")
    int updateStatus(@Param("id") String id,
                     @Param("status") AutoReplyStatus status,
                     @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Comment c SET c.autoReplyStatus = :status, c.sentiment = :sentiment, c.updatedAt = :now WHERE c.id = :id AND c.autoReplyStatus = com.sfiya.autoreply.model.AutoReplyStatus.PENDING")
    int updateStatusAndSentiment(@Param("id") String id,
                                 @Param("status") AutoReplyStatus status,
                                 @Param("sentiment") String sentiment,
                                 @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Comment c SET c.liked = true, c.updatedAt = :now WHERE c.id = :id")
    int markLiked(@Param("id") String id, @Param("now") LocalDateTime now);
}
