package com.sfiya.autoreply.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GenerateReplyRequest {
    @NotBlank(message = "comment_id is required")
    @JsonProperty("comment_id")
    @JsonAlias("commentId")
    private String commentId;

    @NotBlank(message = "user_id is required")
    @JsonProperty("user_id")
    @JsonAlias("userId")
    private String userId;

    @NotBlank(message = "comment_text is required")
    @JsonProperty("comment_text")
    @JsonAlias("commentText")
    private String commentText;

    @NotBlank(message = "platform is required")
    private String platform;
}
