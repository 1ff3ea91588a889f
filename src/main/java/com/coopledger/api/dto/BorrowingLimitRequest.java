package com.coopledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Savings multiplier for a tier, with an optional absolute cap.
 */
@Data
public class BorrowingLimitRequest {

    @NotNull(message = "Multiplier is required")
    @PositiveOrZero(message = "Multiplier cannot be negative")
    private BigDecimal multiplier;

    @Positive(message = "Maximum amount must be positive")
    private BigDecimal maxAmount;

    @NotNull(message = "Effective date is required")
    private LocalDate effectiveFrom;
}
