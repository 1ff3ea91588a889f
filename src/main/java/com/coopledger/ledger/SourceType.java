package com.coopledger.ledger;

/**
 * What produced a journal entry.
 */
public enum SourceType {
    DEPOSIT_APPROVAL,
    CYCLE_INITIAL_REQUIREMENT,
    EXCESS_CONTRIBUTION,
    PENALTY,
    LOAN_DISBURSEMENT,
    REVERSAL,
    MANUAL
}
