package com.coopledger.penalties;

public enum PenaltyRecordStatus {
    PENDING,
    APPROVED,
    PAID
}
