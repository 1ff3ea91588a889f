package com.coopledger.rules;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * The requested term must have an interest rate for the member's tier.
 */
@Component
@Order(4)
public class TermRateRule implements LoanApplicationRule {

    @Override
    public RuleResult evaluate(LoanApplicationRequest request) {
        if (request.getEligibility().getRates().rateFor(request.getTermMonths()).isEmpty()) {
            return RuleResult.decline(String.format("No interest rate is offered for a %d-month term in tier %s",
                request.getTermMonths(), request.getEligibility().getTier().getName()));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "TermRate";
    }
}
