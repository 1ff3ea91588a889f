package com.coopledger.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AddTierRequest {

    @NotBlank(message = "Tier name is required")
    private String name;

    @NotNull(message = "Tier order is required")
    @Min(value = 1, message = "Tier order starts at 1")
    private Integer tierOrder;

    private String description;
}
