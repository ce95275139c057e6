package com.sfiya.autoreply.service;

import com.sfiya.autoreply.model.Platform;

/**
 * Hands platform side effects to the delivery layer. Implementations record the request;
 * they do not confirm that the platform applied it.
 */
public interface PlatformActionGateway {

    void requestLike(String userId, String commentId, Platform platform);
}
