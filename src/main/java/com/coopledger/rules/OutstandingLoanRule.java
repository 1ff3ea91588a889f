package com.coopledger.rules;

import com.coopledger.common.Amounts;
import com.coopledger.loans.Loan;
import com.coopledger.loans.LoanPosition;
import com.coopledger.loans.LoanRepository;
import com.coopledger.loans.LoanStatus;
import com.coopledger.loans.RepaymentTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * A member with an active loan that still has principal outstanding may not apply again.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class OutstandingLoanRule implements LoanApplicationRule {

    private final LoanRepository loanRepository;
    private final RepaymentTracker repaymentTracker;

    @Override
    public RuleResult evaluate(LoanApplicationRequest request) {
        for (Loan loan : loanRepository.findByMemberIdAndStatusIn(request.getMemberId(), LoanStatus.ACTIVE)) {
            LoanPosition position = repaymentTracker.positionOf(loan);
            if (position.getOutstandingPrincipal().compareTo(Amounts.TOLERANCE) > 0) {
                return RuleResult.decline(String.format("Member has an active loan %s with %s outstanding",
                    loan.getId(), position.getOutstandingPrincipal()));
            }
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "OutstandingLoan";
    }
}
