package com.coopledger.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class LoanApplicationForm {

    @NotBlank(message = "Member ID is required")
    private String memberId;

    @NotBlank(message = "Cycle ID is required")
    private String cycleId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    @NotNull(message = "Term is required")
    @Min(value = 1, message = "Term must be at least one month")
    private Integer termMonths;

    private String notes;
}
