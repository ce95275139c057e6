package com.sfiya.autoreply.service;

import com.sfiya.autoreply.model.Platform;

public record IncomingComment(String commentId, String userId, String commentText, Platform platform) {
}
