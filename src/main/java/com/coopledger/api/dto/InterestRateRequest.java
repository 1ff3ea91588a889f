package com.coopledger.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

/**
 * A per-cycle interest rate for a tier. Leave the term empty for a rate covering all terms.
 */
@Data
public class InterestRateRequest {

    @NotBlank(message = "Cycle ID is required")
    private String cycleId;

    @Min(value = 1, message = "Term must be at least one month")
    private Integer termMonths;

    @NotNull(message = "Interest rate is required")
    @PositiveOrZero(message = "Interest rate cannot be negative")
    @DecimalMax(value = "100.00", message = "Interest rate is a percentage")
    private BigDecimal interestRate;
}
