package com.coopledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of an account statement, with the balance after the line was applied.
 */
@Value
public class StatementLine {
    LocalDate entryDate;
    String entryId;
    String description;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    BigDecimal runningBalance;
}
