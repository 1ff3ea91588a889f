package com.coopledger.loans;

import java.util.EnumSet;
import java.util.Set;

public enum LoanStatus {
    PENDING,
    APPROVED,
    DISBURSED,
    OPEN,
    CLOSED,
    WITHDRAWN,
    REJECTED;

    /**
     * Loans that still count against the member: approved, or paid out and not yet closed.
     */
    public static final Set<LoanStatus> ACTIVE = EnumSet.of(APPROVED, DISBURSED, OPEN);

    /**
     * Loans whose money has left the cooperative and can receive repayments.
     */
    public static final Set<LoanStatus> REPAYABLE = EnumSet.of(DISBURSED, OPEN);
}
