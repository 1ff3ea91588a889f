package com.coopledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RecordPenaltyRequest {

    @NotBlank(message = "Member ID is required")
    private String memberId;

    @NotBlank(message = "Penalty type ID is required")
    private String penaltyTypeId;

    private String cycleId;

    private String notes;
}
