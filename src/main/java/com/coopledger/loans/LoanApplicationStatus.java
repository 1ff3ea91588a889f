package com.coopledger.loans;

public enum LoanApplicationStatus {
    PENDING,
    APPROVED,
    REJECTED,
    WITHDRAWN
}
