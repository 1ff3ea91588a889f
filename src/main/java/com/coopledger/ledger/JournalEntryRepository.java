package com.coopledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for journal entry headers.
 */
@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, String> {

    List<JournalEntry> findBySourceTypeAndSourceRef(SourceType sourceType, String sourceRef);

    boolean existsBySourceTypeAndSourceRefAndReversedAtIsNull(SourceType sourceType, String sourceRef);

    List<JournalEntry> findByCycleIdOrderByEntryDateAsc(String cycleId);
}
