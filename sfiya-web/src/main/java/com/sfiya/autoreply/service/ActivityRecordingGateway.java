package com.sfiya.autoreply.service;

import com.sfiya.autoreply.model.ActivityStatus;
import com.sfiya.autoreply.model.EngagementActivity;
import com.sfiya.autoreply.model.Platform;
import com.sfiya.autoreply.repository.EngagementActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Queues like requests as {@code REQUESTED} engagement activity rows for the platform worker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActivityRecordingGateway implements PlatformActionGateway {

    private final EngagementActivityRepository activityRepository;

    @Override
    public void requestLike(String userId, String commentId, Platform platform) {
        EngagementActivity activity = new EngagementActivity();
        activity.setUserId(userId);
        activity.setCommentId(commentId);
        activity.setPlatform(platform);
        activity.setActionType(EngagementActivity.ACTION_LIKE);
        activity.setStatus(ActivityStatus.REQUESTED);
        activityRepository.save(activity);
        log.debug("Like requested for comment {} on {}", commentId, platform);
    }
}
