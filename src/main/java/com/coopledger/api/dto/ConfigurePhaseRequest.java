package com.coopledger.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ConfigurePhaseRequest {

    @Min(value = 1, message = "Start day must be between 1 and 31")
    @Max(value = 31, message = "Start day must be between 1 and 31")
    private Integer startDay;

    @Min(value = 1, message = "End day must be between 1 and 31")
    @Max(value = 31, message = "End day must be between 1 and 31")
    private Integer endDay;

    private String penaltyTypeId;

    private boolean autoApplyPenalty;
}
