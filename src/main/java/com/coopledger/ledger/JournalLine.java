package com.coopledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One debit or credit against a single account.
 * The entry date is copied from the header so balances can be taken as of a date.
 */
@Entity
@Table(name = "journal_lines", indexes = {
    @Index(name = "idx_journal_line_entry", columnList = "entry_id"),
    @Index(name = "idx_journal_line_account", columnList = "account_id, entry_date")
})
@Data
@NoArgsConstructor
public class JournalLine {

    @Id
    private String id;

    @Column(name = "entry_id", nullable = false, updatable = false)
    private String entryId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(name = "entry_date", nullable = false, updatable = false)
    private LocalDate entryDate;

    @Column(name = "debit_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal debitAmount;

    @Column(name = "credit_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal creditAmount;

    private String description;

    public JournalLine(JournalEntry entry, int lineNumber, String accountId,
                       BigDecimal debitAmount, BigDecimal creditAmount, String description) {
        this.id = UUID.randomUUID().toString();
        this.entryId = entry.getId();
        this.entryDate = entry.getEntryDate();
        this.lineNumber = lineNumber;
        this.accountId = accountId;
        this.debitAmount = debitAmount;
        this.creditAmount = creditAmount;
        this.description = description;
    }
}
