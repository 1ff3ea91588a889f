package com.coopledger.common.exception;

import java.math.BigDecimal;

/**
 * Thrown when a journal entry's debits and credits differ.
 */
public class ImbalancedEntryException extends ValidationException {

    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;

    public ImbalancedEntryException(BigDecimal totalDebits, BigDecimal totalCredits) {
        super(String.format("Journal entry is not balanced: debits=%s, credits=%s",
            totalDebits, totalCredits));
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }
}
