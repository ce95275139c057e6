package com.sfiya.autoreply.repository;

import com.sfiya.autoreply.model.AutoReply;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface AutoReplyRepository extends JpaRepository<AutoReply, UUID> {
    boolean existsByCommentId(String commentId);
}
