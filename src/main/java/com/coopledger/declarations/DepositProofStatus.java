package com.coopledger.declarations;

public enum DepositProofStatus {
    SUBMITTED,
    APPROVED,
    REJECTED
}
