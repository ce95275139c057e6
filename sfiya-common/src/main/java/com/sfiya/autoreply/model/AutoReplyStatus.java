package com.sfiya.autoreply.model;

public enum AutoReplyStatus {
    PENDING,
    REPLIED,
    IGNORED,
    ESCALATED
}
