package com.sfiya.autoreply.exception;

public class SettingsNotFoundException extends ResourceNotFoundException {
    private final String userId;

    public SettingsNotFoundException(String userId) {
        super("Settings not found");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
