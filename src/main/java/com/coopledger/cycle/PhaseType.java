package com.coopledger.cycle;

/**
 * Recurring windows within a cycle.
 *
 * Declaration and loan application windows fall inside the effective month.
 * The deposits window opens in the effective month and ends in the month after it.
 */
public enum PhaseType {
    DECLARATION,
    LOAN_APPLICATION,
    DEPOSITS,
    PAYOUT,
    SHAREOUT;

    public boolean spansIntoNextMonth() {
        return this == DEPOSITS;
    }
}
