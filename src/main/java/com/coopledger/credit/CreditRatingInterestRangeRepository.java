package com.coopledger.credit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CreditRatingInterestRangeRepository extends JpaRepository<CreditRatingInterestRange, String> {

    List<CreditRatingInterestRange> findByTierIdAndCycleId(String tierId, String cycleId);
}
