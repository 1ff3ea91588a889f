package com.coopledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * An account in the chart of accounts.
 *
 * Organization accounts have no member; member sub-accounts carry the member id
 * and the fund they track, with at most one account per (member, fund).
 */
@Entity
@Table(name = "ledger_accounts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_ledger_account_code", columnNames = "code"),
    @UniqueConstraint(name = "uk_ledger_account_member_fund", columnNames = {"member_id", "fund_kind"})
})
@Data
@NoArgsConstructor
public class LedgerAccount {

    @Id
    private String id;

    @Column(nullable = false, length = 32)
    private String code;

    @Column(nullable = false)
    private String name;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false)
    private AccountType accountType;

    @Column(name = "member_id")
    private String memberId;

    @Enumerated(EnumType.STRING)
    @Column(name = "fund_kind")
    private FundKind fundKind;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerAccount(String code, String name, AccountType accountType) {
        this.id = UUID.randomUUID().toString();
        this.code = code;
        this.name = name;
        this.accountType = accountType;
        this.active = true;
        this.createdAt = Instant.now();
    }

    public static LedgerAccount forOrganization(OrgAccount orgAccount) {
        return new LedgerAccount(orgAccount.getCode(), orgAccount.getDisplayName(),
            orgAccount.getAccountType());
    }

    public static LedgerAccount forMember(String code, String memberName, String memberId, FundKind fundKind) {
        LedgerAccount account = new LedgerAccount(code,
            memberName + " - " + fundKind.getDisplayName(), fundKind.getAccountType());
        account.description = fundKind.getDisplayName() + " sub-ledger for member " + memberId;
        account.memberId = memberId;
        account.fundKind = fundKind;
        return account;
    }

    public boolean isMemberAccount() {
        return memberId != null;
    }
}
