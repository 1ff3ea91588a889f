package com.coopledger.ledger;

/**
 * Organization-level accounts every posting path relies on.
 * They are looked up by code and must exist before anything is posted.
 */
public enum OrgAccount {
    BANK_CASH("BANK_CASH", "Bank Cash", AccountType.ASSET),
    LOANS_RECEIVABLE("LOANS_RECEIVABLE", "Loans Receivable", AccountType.ASSET),
    INTEREST_INCOME("INTEREST_INCOME", "Interest Income", AccountType.INCOME),
    PENALTY_INCOME("PENALTY_INCOME", "Penalty Income", AccountType.INCOME),
    SOCIAL_FUND("SOCIAL_FUND", "Social Fund", AccountType.LIABILITY),
    ADMIN_FUND("ADMIN_FUND", "Admin Fund", AccountType.LIABILITY),
    MEMBER_EQUITY("MEMBER_EQUITY", "Member Equity", AccountType.EQUITY);

    private final String code;
    private final String displayName;
    private final AccountType accountType;

    OrgAccount(String code, String displayName, AccountType accountType) {
        this.code = code;
        this.displayName = displayName;
        this.accountType = accountType;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public AccountType getAccountType() {
        return accountType;
    }
}
