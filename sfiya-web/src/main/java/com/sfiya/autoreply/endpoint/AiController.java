package com.sfiya.autoreply.endpoint;

import com.sfiya.autoreply.dto.GenerateReplyRequest;
import com.sfiya.autoreply.dto.ReplyDecision;
import com.sfiya.autoreply.model.Platform;
import com.sfiya.autoreply.service.AutoReplyPipeline;
import com.sfiya.autoreply.service.IncomingComment;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
@Slf4j
public class AiController {

    private final AutoReplyPipeline autoReplyPipeline;

    /**
     * Called by the ingestion layer once per new comment.
     */
    @PostMapping("/generate-reply")
    public ResponseEntity<ReplyDecision> generateReply(@Valid @RequestBody GenerateReplyRequest request) {
        Platform platform = Platform.fromValue(request.getPlatform())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported platform: " + request.getPlatform()));

        log.debug("Processing comment {} for user {}", request.getCommentId(), request.getUserId());
        ReplyDecision decision = autoReplyPipeline.process(new IncomingComment(
                request.getCommentId(), request.getUserId(), request.getCommentText(), platform));
        return ResponseEntity.ok(decision);
    }
}
