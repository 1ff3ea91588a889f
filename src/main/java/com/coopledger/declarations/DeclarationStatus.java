package com.coopledger.declarations;

public enum DeclarationStatus {
    PENDING,
    PROOF,
    APPROVED,
    REJECTED
}
