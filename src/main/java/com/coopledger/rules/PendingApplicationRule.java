package com.coopledger.rules;

import com.coopledger.loans.LoanApplicationRepository;
import com.coopledger.loans.LoanApplicationStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * A member may have only one application awaiting a decision.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class PendingApplicationRule implements LoanApplicationRule {

    private final LoanApplicationRepository applicationRepository;

    @Override
    public RuleResult evaluate(LoanApplicationRequest request) {
        if (applicationRepository.existsByMemberIdAndStatus(request.getMemberId(), LoanApplicationStatus.PENDING)) {
            return RuleResult.decline("Member already has a pending loan application");
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "PendingApplication";
    }
}
