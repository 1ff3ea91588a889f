package com.coopledger.credit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface BorrowingLimitPolicyRepository extends JpaRepository<BorrowingLimitPolicy, String> {

    Optional<BorrowingLimitPolicy> findByTierIdAndEffectiveFrom(String tierId, LocalDate effectiveFrom);

    Optional<BorrowingLimitPolicy> findFirstByTierIdAndEffectiveFromLessThanEqualOrderByEffectiveFromDesc(
        String tierId, LocalDate date);
}
