package com.coopledger.cycle;

public enum CycleStatus {
    DRAFT,
    ACTIVE,
    CLOSED
}
