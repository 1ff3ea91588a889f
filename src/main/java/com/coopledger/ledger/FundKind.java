package com.coopledger.ledger;

/**
 * Per-member sub-accounts.
 *
 * Savings is what the cooperative owes the member. The other three are what the
 * member owes the cooperative: a debit raises the amount due, a payment credits it.
 */
public enum FundKind {
    SAVINGS("MEM_SAV", "Savings", AccountType.LIABILITY),
    SOCIAL_FUND("MEM_SOC", "Social Fund", AccountType.ASSET),
    ADMIN_FUND("MEM_ADM", "Admin Fund", AccountType.ASSET),
    PENALTIES_PAYABLE("PEN_PAY", "Penalties Payable", AccountType.ASSET);

    private final String codePrefix;
    private final String displayName;
    private final AccountType accountType;

    FundKind(String codePrefix, String displayName, AccountType accountType) {
        this.codePrefix = codePrefix;
        this.displayName = displayName;
        this.accountType = accountType;
    }

    public String getCodePrefix() {
        return codePrefix;
    }

    public String getDisplayName() {
        return displayName;
    }

    public AccountType getAccountType() {
        return accountType;
    }
}
