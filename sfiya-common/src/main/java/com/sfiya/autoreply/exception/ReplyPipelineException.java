package com.sfiya.autoreply.exception;

/**
 * Hard failure of a pipeline run. The message is safe to show to callers; the cause
 * carries the internal detail and is only logged.
 */
public class ReplyPipelineException extends RuntimeException {
    public static final String PUBLIC_MESSAGE = "Failed to generate reply";

    private final String commentId;

    public ReplyPipelineException(String commentId, String detail, Throwable cause) {
        super(PUBLIC_MESSAGE, new IllegalStateException(detail, cause));
        this.commentId = commentId;
    }

    public ReplyPipelineException(String commentId, String detail) {
        super(PUBLIC_MESSAGE, new IllegalStateException(detail));
        this.commentId = commentId;
    }

    public String getCommentId() {
        return commentId;
    }
}
