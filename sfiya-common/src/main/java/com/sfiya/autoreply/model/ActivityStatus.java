package com.sfiya.autoreply.model;

public enum ActivityStatus {
    REQUESTED,
    CONFIRMED,
    FAILED
}
