package com.coopledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class CreateCycleRequest {

    @NotNull(message = "Year is required")
    private Integer year;

    @NotNull(message = "Start date is required")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    private LocalDate endDate;

    @PositiveOrZero(message = "Social fund requirement cannot be negative")
    private BigDecimal socialFundRequired;

    @PositiveOrZero(message = "Admin fund requirement cannot be negative")
    private BigDecimal adminFundRequired;
}
