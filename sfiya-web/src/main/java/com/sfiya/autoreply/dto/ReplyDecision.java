package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Terminal outcome of one pipeline run. {@code reason} is set for suppressed comments,
 * {@code reply} only when a reply was generated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplyDecision(boolean success, DecisionAction action, String reason, ReplySummary reply) {

    public static ReplyDecision ignored(String reason) {
        return new ReplyDecision(true, DecisionAction.IGNORED, reason, null);
    }

    public static ReplyDecision escalated(String reason) {
        return new ReplyDecision(true, DecisionAction.ESCALATED, reason, null);
    }

    public static ReplyDecision replied(ReplySummary reply) {
        return new ReplyDecision(true, DecisionAction.REPLIED, null, reply);
    }
}
