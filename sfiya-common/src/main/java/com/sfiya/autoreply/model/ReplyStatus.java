package com.sfiya.autoreply.model;

public enum ReplyStatus {
    PENDING,
    SENT,
    FAILED
}
