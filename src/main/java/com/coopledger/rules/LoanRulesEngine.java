package com.coopledger.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates all loan application rules in order. The first rule that declines
 * decides the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanRulesEngine {

    private final List<LoanApplicationRule> rules;

    public RuleResult evaluateRules(LoanApplicationRequest request) {
        log.debug("Evaluating {} rules for loan application by member {}", rules.size(), request.getMemberId());

        for (LoanApplicationRule rule : rules) {
            RuleResult result = rule.evaluate(request);

            if (!result.isApproved()) {
                log.info("Rule {} declined loan application by member {}: {}",
                    rule.getRuleName(), request.getMemberId(), result.getReason());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        return RuleResult.approve();
    }
}
