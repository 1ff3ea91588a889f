package com.coopledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for journal lines and the aggregate queries balances are computed from.
 */
@Repository
public interface JournalLineRepository extends JpaRepository<JournalLine, String> {

    List<JournalLine> findByEntryIdOrderByLineNumberAsc(String entryId);

    List<JournalLine> findByAccountIdOrderByEntryDateAscLineNumberAsc(String accountId);

    @Query("select new com.coopledger.ledger.LineTotals(sum(l.debitAmount), sum(l.creditAmount)) "
        + "from JournalLine l where l.accountId = :accountId")
    LineTotals totalsFor(@Param("accountId") String accountId);

    @Query("select new com.coopledger.ledger.LineTotals(sum(l.debitAmount), sum(l.creditAmount)) "
        + "from JournalLine l where l.accountId = :accountId and l.entryDate <= :asOf")
    LineTotals totalsAsOf(@Param("accountId") String accountId, @Param("asOf") LocalDate asOf);

    /**
     * Totals of lines on an account from live (not reversed) entries of one source type in one cycle.
     */
    @Query("select new com.coopledger.ledger.LineTotals(sum(l.debitAmount), sum(l.creditAmount)) "
        + "from JournalLine l, JournalEntry e "
        + "where l.entryId = e.id and l.accountId = :accountId "
        + "and e.sourceType = :sourceType and e.cycleId = :cycleId and e.reversedAt is null")
    LineTotals liveTotalsBySource(@Param("accountId") String accountId,
                                  @Param("sourceType") SourceType sourceType,
                                  @Param("cycleId") String cycleId);
}
