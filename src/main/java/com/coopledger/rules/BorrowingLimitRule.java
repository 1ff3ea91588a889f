package com.coopledger.rules;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Rule that caps the requested amount at the member's savings times their tier multiplier.
 */
@Component
@Order(3)
public class BorrowingLimitRule implements LoanApplicationRule {

    @Override
    public RuleResult evaluate(LoanApplicationRequest request) {
        BigDecimal maxLoan = request.getEligibility().getMaxLoanAmount();
        if (request.getAmount().compareTo(maxLoan) > 0) {
            return RuleResult.decline(String.format("Requested amount %s exceeds borrowing limit %s",
                request.getAmount(), maxLoan));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "BorrowingLimit";
    }
}
