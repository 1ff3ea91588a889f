package com.coopledger.declarations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DeclarationRepository extends JpaRepository<Declaration, String> {

    Optional<Declaration> findByMemberIdAndCycleIdAndEffectiveMonth(String memberId, String cycleId,
                                                                    LocalDate effectiveMonth);

    boolean existsByMemberIdAndCycleIdAndEffectiveMonth(String memberId, String cycleId, LocalDate effectiveMonth);

    List<Declaration> findByMemberIdAndCycleIdOrderByEffectiveMonthAsc(String memberId, String cycleId);

    List<Declaration> findByCycleIdAndStatus(String cycleId, DeclarationStatus status);
}
