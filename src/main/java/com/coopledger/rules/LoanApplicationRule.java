package com.coopledger.rules;

/**
 * Interface for loan application rules.
 *
 * Each rule evaluates an application before it is accepted and returns a result
 * indicating whether it may proceed.
 */
public interface LoanApplicationRule {

    /**
     * Evaluate the rule against a loan application.
     *
     * @param request the application to evaluate, with the member's resolved eligibility
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(LoanApplicationRequest request);

    String getRuleName();
}
