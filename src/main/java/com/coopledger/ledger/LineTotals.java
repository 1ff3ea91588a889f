package com.coopledger.ledger;

import com.coopledger.common.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Debit and credit sums for an account. Empty sums come back from the database as null.
 */
@Value
public class LineTotals {

    BigDecimal debits;
    BigDecimal credits;

    public LineTotals(BigDecimal debits, BigDecimal credits) {
        this.debits = Amounts.normalize(debits);
        this.credits = Amounts.normalize(credits);
    }

    public BigDecimal balanceFor(AccountType accountType) {
        return accountType.isDebitNormal()
            ? debits.subtract(credits)
            : credits.subtract(debits);
    }
}
