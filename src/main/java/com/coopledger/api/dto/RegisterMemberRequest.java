package com.coopledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RegisterMemberRequest {

    @NotBlank(message = "User ID is required")
    private String userId;

    @NotBlank(message = "Display name is required")
    private String displayName;
}
