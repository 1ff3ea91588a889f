package com.coopledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A debit or credit to be posted as part of a journal entry.
 */
@Value
public class JournalLineRequest {

    String accountId;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    String description;

    public static JournalLineRequest debit(String accountId, BigDecimal amount, String description) {
        return new JournalLineRequest(accountId, amount, BigDecimal.ZERO, description);
    }

    public static JournalLineRequest credit(String accountId, BigDecimal amount, String description) {
        return new JournalLineRequest(accountId, BigDecimal.ZERO, amount, description);
    }
}
