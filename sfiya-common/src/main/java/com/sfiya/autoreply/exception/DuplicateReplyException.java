package com.sfiya.autoreply.exception;

public class DuplicateReplyException extends RuntimeException {
    public static final String REPLY_EXISTS = "Reply already generated for this comment";
    public static final String ALREADY_PROCESSED = "Comment already processed";

    private final String commentId;

    public DuplicateReplyException(String commentId, String message) {
        super(message);
        this.commentId = commentId;
    }

    public DuplicateReplyException(String commentId, Throwable cause) {
        super(REPLY_EXISTS, cause);
        this.commentId = commentId;
    }

    public String getCommentId() {
        return commentId;
    }
}
