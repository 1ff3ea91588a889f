package com.coopledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AssignTierRequest {

    @NotBlank(message = "Member ID is required")
    private String memberId;

    @NotBlank(message = "Cycle ID is required")
    private String cycleId;

    @NotBlank(message = "Tier ID is required")
    private String tierId;

    private String notes;
}
