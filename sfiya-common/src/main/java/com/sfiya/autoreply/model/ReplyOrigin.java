package com.sfiya.autoreply.model;

public enum ReplyOrigin {
    AI,
    HUMAN
}
