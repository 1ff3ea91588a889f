package com.coopledger.api.dto;

import com.coopledger.declarations.DeclaredAmounts;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for creating or editing a monthly declaration.
 * Member, cycle and month are ignored on edits.
 */
@Data
public class DeclarationRequest {

    private String memberId;

    private String cycleId;

    private LocalDate effectiveMonth;

    @PositiveOrZero(message = "Savings amount cannot be negative")
    private BigDecimal savingsAmount;

    @PositiveOrZero(message = "Social fund amount cannot be negative")
    private BigDecimal socialFundAmount;

    @PositiveOrZero(message = "Admin fund amount cannot be negative")
    private BigDecimal adminFundAmount;

    @PositiveOrZero(message = "Penalties amount cannot be negative")
    private BigDecimal penaltiesAmount;

    @PositiveOrZero(message = "Interest on loan amount cannot be negative")
    private BigDecimal interestOnLoanAmount;

    @PositiveOrZero(message = "Loan repayment amount cannot be negative")
    private BigDecimal loanRepaymentAmount;

    public DeclaredAmounts toAmounts() {
        return DeclaredAmounts.builder()
            .savings(savingsAmount)
            .socialFund(socialFundAmount)
            .adminFund(adminFundAmount)
            .penalties(penaltiesAmount)
            .interestOnLoan(interestOnLoanAmount)
            .loanRepayment(loanRepaymentAmount)
            .build();
    }
}
