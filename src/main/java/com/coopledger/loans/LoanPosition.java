package com.coopledger.loans;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * How much of a loan has been repaid.
 */
@Value
@Builder
public class LoanPosition {
    String loanId;
    LoanStatus status;
    BigDecimal amount;
    BigDecimal interestRate;
    BigDecimal principalPaid;
    BigDecimal interestPaid;
    BigDecimal expectedInterest;
    BigDecimal outstandingPrincipal;
    boolean fullyRepaid;
}
