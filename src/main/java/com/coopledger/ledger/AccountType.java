package com.coopledger.ledger;

/**
 * Ledger account classes. Assets and expenses are debit-normal, the rest credit-normal.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE;

    public boolean isDebitNormal() {
        return this == ASSET || this == EXPENSE;
    }
}
