package com.coopledger.declarations;

import com.coopledger.common.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The six amounts a member declares for a month. Missing components count as zero.
 */
@Value
@Builder
public class DeclaredAmounts {
    BigDecimal savings;
    BigDecimal socialFund;
    BigDecimal adminFund;
    BigDecimal penalties;
    BigDecimal interestOnLoan;
    BigDecimal loanRepayment;

    /**
     * Copy with every component normalized to two decimals and checked to be non-negative.
     */
    public DeclaredAmounts validated() {
        return new DeclaredAmounts(
            Amounts.requireNonNegative(savings, "Savings amount"),
            Amounts.requireNonNegative(socialFund, "Social fund amount"),
            Amounts.requireNonNegative(adminFund, "Admin fund amount"),
            Amounts.requireNonNegative(penalties, "Penalties amount"),
            Amounts.requireNonNegative(interestOnLoan, "Interest on loan amount"),
            Amounts.requireNonNegative(loanRepayment, "Loan repayment amount"));
    }

    public BigDecimal total() {
        return Amounts.sum(savings, socialFund, adminFund, penalties, interestOnLoan, loanRepayment);
    }
}
