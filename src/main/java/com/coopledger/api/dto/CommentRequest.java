package com.coopledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * A free-text comment, reason or response attached to a decision.
 */
@Data
public class CommentRequest {

    @NotBlank(message = "Comment is required")
    private String comment;
}
